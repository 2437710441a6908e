/** Small helpers shared by the parser stages. */
package io.inpdeck.utils;

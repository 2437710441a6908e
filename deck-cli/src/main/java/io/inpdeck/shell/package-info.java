/**
 * Command line driver: parses one deck and prints it as an outline, JSON, canonical text or
 * preprocessed lines.
 */
package io.inpdeck.shell;

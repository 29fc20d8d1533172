package io.routelint.shell;

/** Output format of the commands. */
public enum OutputFormat {
  TEXT,
  JSON
}

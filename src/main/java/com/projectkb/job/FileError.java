package com.projectkb.job;

import com.projectkb.ingest.ErrorKind;

public record FileError(int index, String filename, ErrorKind kind, String message) {
}

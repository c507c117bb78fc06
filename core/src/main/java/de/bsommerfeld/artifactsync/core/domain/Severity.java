package de.bsommerfeld.artifactsync.core.domain;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}

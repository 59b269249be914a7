package io.github.yok.sqlbackup.config;

/**
 * Transaction boundary used when replaying a dump.
 */
public enum TransactionScope {

    /** One transaction per table section. */
    TABLE,

    /** One transaction spanning every table section of the file. */
    FILE
}

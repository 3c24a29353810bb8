package com.cred.freestyle.erp.infrastructure.archive;

import java.io.IOException;

/**
 * Thrown when a file opens as a ZIP container but does not have the backup archive layout,
 * or one of its entries fails its checksum.
 *
 * @author ERP Platform Team
 */
public class InvalidArchiveException extends IOException {

    public InvalidArchiveException(String message) {
        super(message);
    }

    public InvalidArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}

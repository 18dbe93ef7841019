package com.autobudget.exception;

/** The channel spreadsheet could not be downloaded or has no usable header row. */
public class DirectoryLoadException extends AutoBudgetException {

    public DirectoryLoadException(String message) {
        super(ErrorCode.DIRECTORY_ERROR, message, null, null);
    }

    public DirectoryLoadException(String message, Throwable cause) {
        super(ErrorCode.DIRECTORY_ERROR, message, null, cause);
    }
}

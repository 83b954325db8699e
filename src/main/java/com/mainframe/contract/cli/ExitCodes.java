package com.mainframe.contract.cli;

final class ExitCodes {

    static final int OK = 0;
    static final int FAILURE = 1;
    static final int INVALID_OPTIONS = 2;

    private ExitCodes() {
    }
}

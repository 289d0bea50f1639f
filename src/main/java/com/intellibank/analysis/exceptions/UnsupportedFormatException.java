package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

public class UnsupportedFormatException extends StatementAnalysisException {

    public UnsupportedFormatException(String declaredFormat) {
        super(ErrorKind.UNSUPPORTED_FORMAT, false,
                "Unsupported statement format: " + declaredFormat + " (expected pdf, csv or spreadsheet)");
    }
}

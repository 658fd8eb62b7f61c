package com.zzf.optrace.session;

import com.zzf.optrace.model.CustomException;

public class InvalidTraceFlagException extends CustomException {

    public InvalidTraceFlagException(String variable, String value) {
        super("WRONG_VALUE_FOR_VAR", "Variable '" + variable + "' can't be set to the value of '" + value + "'");
    }
}

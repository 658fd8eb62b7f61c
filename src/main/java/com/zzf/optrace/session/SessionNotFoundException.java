package com.zzf.optrace.session;

import com.zzf.optrace.model.CustomException;

public class SessionNotFoundException extends CustomException {

    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", "Unknown session: " + sessionId);
    }
}

package com.propgate.backend.modules.intercom.application;

import com.propgate.backend.modules.intercom.domain.AccessContext;
import com.propgate.backend.modules.intercom.domain.FacePayload;

public record VerifyAccessCommand(
        Long accessPointId,
        String pin,
        FacePayload face,
        AccessContext context
) {

    public VerifyAccessCommand {
        context = context == null ? AccessContext.empty() : context;
    }
}

package com.alonica.pos.domain.deletion;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

public class DeletionRequestNotFoundException extends DomainException {

    public DeletionRequestNotFoundException(Long requestId) {
        super(ErrorCode.DELETION_REQUEST_NOT_FOUND, "requestId=" + requestId);
    }
}

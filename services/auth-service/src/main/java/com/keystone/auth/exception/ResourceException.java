package com.keystone.auth.exception;

import com.keystone.common.exception.BusinessException;
import com.keystone.common.exception.ErrorCode;

/**
 * Failure of a role, permission or user administration request.
 */
public class ResourceException extends BusinessException {

    public ResourceException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceException roleNotFound(Object roleId) {
        return new ResourceException(ErrorCode.ROLE_NOT_FOUND, "Role not found: " + roleId);
    }

    public static ResourceException permissionNotFound(Object permissionId) {
        return new ResourceException(ErrorCode.PERMISSION_NOT_FOUND, "Permission not found: " + permissionId);
    }
}

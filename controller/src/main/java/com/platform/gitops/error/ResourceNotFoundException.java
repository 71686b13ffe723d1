package com.platform.gitops.error;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.UnitKey;

/**
 * A stored resource the request or write refers to does not exist.
 */
public class ResourceNotFoundException extends ControllerException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException unit(UnitKey key) {
        return new ResourceNotFoundException(ErrorCode.KUSTOMIZATION_NOT_FOUND, Kustomization.KIND, key.toString());
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}

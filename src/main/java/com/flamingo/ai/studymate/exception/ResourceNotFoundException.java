package com.flamingo.ai.studymate.exception;

/** Base type for lookups of a single resource that does not exist. */
public abstract class ResourceNotFoundException extends RuntimeException {

  private final String resourceType;
  private final String resourceId;

  protected ResourceNotFoundException(String resourceType, Object resourceId) {
    super(resourceType + " not found: " + resourceId);
    this.resourceType = resourceType;
    this.resourceId = String.valueOf(resourceId);
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  /** Machine-readable {@link ApiError} code for this resource type. */
  public abstract String getErrorCode();
}

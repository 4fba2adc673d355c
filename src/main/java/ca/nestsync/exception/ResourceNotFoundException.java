package ca.nestsync.exception;

/**
 * Exception thrown when a requested record does not exist, is soft-deleted,
 * or is not visible to the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException child(Object childId) {
        return new ResourceNotFoundException("Child not found");
    }

    public static ResourceNotFoundException of(String resourceType, Object id) {
        return new ResourceNotFoundException(String.format("%s '%s' not found", resourceType, id));
    }
}

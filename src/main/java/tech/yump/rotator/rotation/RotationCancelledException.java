package tech.yump.rotator.rotation;

/**
 * Thrown when the calling thread is interrupted before the next directory call. Writes issued
 * before the interruption are not rolled back.
 */
public class RotationCancelledException extends RuntimeException {
    public RotationCancelledException(String message) {
        super(message);
    }
}

package alignment;

// The estimate could not be aligned to groundtruth.
public class AlignmentException extends Exception {
    public AlignmentException(String message) {
        super(message);
    }

    public AlignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}

package evaluation;

// The dataset label of a run matches none of the supported datasets.
public class UnknownDatasetException extends IllegalArgumentException {
    public UnknownDatasetException(String label) {
        super("Unknown dataset: " + label);
    }
}

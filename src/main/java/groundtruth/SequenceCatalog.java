package groundtruth;

public interface SequenceCatalog {
    /**
     * Returns every sequence of {@code dataset}, in catalog order, with groundtruth loaded.
     *
     * @throws CatalogLoadException if any sequence cannot be loaded; no partial set is returned
     */
    SequenceSet sequences(Dataset dataset) throws CatalogLoadException;
}

package ai.mergepilot.rebase;

/**
 * Position of the resolution engine within the current round. A retry keeps the index and is only produced after a
 * rejected verification.
 */
record FileStep(int index, boolean retry) {
    static FileStep first() {
        return new FileStep(0, false);
    }

    FileStep advance() {
        return new FileStep(index + 1, false);
    }

    FileStep retrySame() {
        return new FileStep(index, true);
    }
}

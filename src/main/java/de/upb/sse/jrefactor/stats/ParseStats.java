package de.upb.sse.jrefactor.stats;

import lombok.Data;

@Data
public class ParseStats {
    private int parsedFiles;
    private int skippedFiles;
    private int unknownNodes;
    private int unresolvedSymbols;

    public void incrementParsedFiles() {
        parsedFiles++;
    }

    public void incrementSkippedFiles() {
        skippedFiles++;
    }

    public void incrementUnknownNodes() {
        unknownNodes++;
    }

    public void incrementUnresolvedSymbols() {
        unresolvedSymbols++;
    }

    public boolean fullyAttributed() {
        return unresolvedSymbols == 0;
    }

    public void reset() {
        parsedFiles = skippedFiles = unknownNodes = unresolvedSymbols = 0;
    }
}

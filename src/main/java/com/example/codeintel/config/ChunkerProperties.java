package com.example.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Conversion del solapamiento en caracteres del perfil a lineas en el modo por estructura:
 * lineas = min(overlapSize / overlapCharsPerLine, maxOverlapLines).
 */
@ConfigurationProperties(prefix = "codeintel.chunker")
public class ChunkerProperties {

    private int overlapCharsPerLine = 50;
    private int maxOverlapLines = 5;

    public int getOverlapCharsPerLine() { return overlapCharsPerLine; }
    public void setOverlapCharsPerLine(int overlapCharsPerLine) { this.overlapCharsPerLine = overlapCharsPerLine; }

    public int getMaxOverlapLines() { return maxOverlapLines; }
    public void setMaxOverlapLines(int maxOverlapLines) { this.maxOverlapLines = maxOverlapLines; }
}

package me.internalizable.zikzi.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where documents are written and how they are converted.
 */
public class StorageConfig {

    private String path = "./data";
    private String ghostscriptBin = "gs";

    // Upper bound for each converter invocation
    private int conversionTimeoutSeconds = 120;

    // 0 means one thread per available processor
    private int conversionThreads = 0;

    // Optional YAML file with users, IP registrations and tokens for the in-memory store
    private String seedFile = null;

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public String getGhostscriptBin() { return ghostscriptBin; }
    public void setGhostscriptBin(String ghostscriptBin) { this.ghostscriptBin = ghostscriptBin; }

    public int getConversionTimeoutSeconds() { return conversionTimeoutSeconds; }
    public void setConversionTimeoutSeconds(int conversionTimeoutSeconds) { this.conversionTimeoutSeconds = conversionTimeoutSeconds; }

    public int getConversionThreads() { return conversionThreads; }
    public void setConversionThreads(int conversionThreads) { this.conversionThreads = conversionThreads; }

    public String getSeedFile() { return seedFile; }
    public void setSeedFile(String seedFile) { this.seedFile = seedFile; }

    /**
     * Directory holding original documents, PDFs and thumbnails.
     */
    public Path getJobsDirectory() {
        return Paths.get(path, "jobs");
    }
}

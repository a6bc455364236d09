package org.carball.recon.model.analysis;

public enum FileStatus {
    ANALYZED,
    FAILED
}

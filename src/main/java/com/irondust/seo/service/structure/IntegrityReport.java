package com.irondust.seo.service.structure;

import java.util.ArrayList;
import java.util.List;

public class IntegrityReport {
    public boolean valid;
    public List<StructureViolation> violations = new ArrayList<>();
    public List<StructureViolation> warnings = new ArrayList<>();
    public boolean structurePreserved;
    public boolean formattingPreserved;
    public boolean intentPreserved;
    public String originalChecksum;
    public String modifiedChecksum;

    public boolean hasMajorViolation() {
        for (StructureViolation v : violations) {
            if (v.isMajor()) return true;
        }
        return false;
    }
}

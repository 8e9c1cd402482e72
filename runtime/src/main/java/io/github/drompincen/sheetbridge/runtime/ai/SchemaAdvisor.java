package io.github.drompincen.sheetbridge.runtime.ai;

import io.github.drompincen.sheetbridge.protocol.api.SchemaProposal;

import java.util.List;

/** Proposes a normalized schema for a file's column labels. */
public interface SchemaAdvisor {

    /**
     * @return one attribute per label, keyed by the label as given
     * @throws io.github.drompincen.sheetbridge.protocol.error.AIProcessingException on an unusable answer
     */
    SchemaProposal propose(List<String> columnLabels);
}

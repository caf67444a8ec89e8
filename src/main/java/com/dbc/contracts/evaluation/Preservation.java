package com.dbc.contracts.evaluation;

import com.dbc.contracts.ContractAttachmentException;
import com.dbc.contracts.function.ContractFunction;
import com.dbc.contracts.function.Preserver;
import com.dbc.contracts.model.CallRecord;
import com.dbc.contracts.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Old-value capture. Preservers live on the innermost original function, so every
 * condition layer around it sees all of them regardless of where they were attached.
 */
public final class Preservation {

    private static final Logger logger = LoggerFactory.getLogger(Preservation.class);

    private Preservation() {
    }

    /**
     * Registers a preserver and returns the target unchanged.
     */
    public static <R> ContractFunction<R> attach(Preserver preserver, ContractFunction<R> target) {
        if (preserver == null) {
            throw new ContractAttachmentException("preservers must be callable");
        }
        target.addPreserver(preserver);
        logger.debug("Attached preserver to {}", target.unwrap());
        return target;
    }

    /**
     * Runs every preserver of the target's original against the record and merges the results.
     * Distinct keys merge independently of order; for a repeated key the later preserver wins.
     */
    public static Snapshot capture(ContractFunction<?> target, CallRecord args) {
        List<Preserver> preservers = target.preservers();
        if (preservers.isEmpty()) {
            return Snapshot.empty();
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Preserver preserver : preservers) {
            Map<String, ?> captured = preserver.capture(args);
            if (captured != null) {
                merged.putAll(captured);
            }
        }
        return Snapshot.of(merged);
    }
}

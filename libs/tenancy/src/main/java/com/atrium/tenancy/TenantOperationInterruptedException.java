package com.atrium.tenancy;

import com.atrium.common.AtriumException;
import com.atrium.common.FailureCategory;
import java.util.Map;

/**
 * Thrown when a document copy is interrupted. The partially filled target is left in place;
 * reclaim it and rerun the rename to restart.
 */
public class TenantOperationInterruptedException extends AtriumException {

    private final long documentsCopied;

    public TenantOperationInterruptedException(String source, String target, long documentsCopied) {
        super(FailureCategory.INTERNAL,
                "Copy from '%s' to '%s' interrupted after %d documents"
                        .formatted(source, target, documentsCopied),
                Map.of("source", source, "target", target,
                        "documentsCopied", Long.toString(documentsCopied)));
        this.documentsCopied = documentsCopied;
    }

    public long documentsCopied() {
        return documentsCopied;
    }
}

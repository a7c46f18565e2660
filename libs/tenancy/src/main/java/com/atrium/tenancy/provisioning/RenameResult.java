package com.atrium.tenancy.provisioning;

/**
 * Outcome of a rename.
 *
 * @param previousStorageResourceName resource the organization used before; still exists
 * @param storageResourceName         resource the organization uses now
 * @param slug                        new slug
 * @param documentsCopied             documents copied from the previous resource
 */
public record RenameResult(
        String previousStorageResourceName,
        String storageResourceName,
        String slug,
        long documentsCopied) {
}

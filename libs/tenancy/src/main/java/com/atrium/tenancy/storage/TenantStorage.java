package com.atrium.tenancy.storage;

import com.atrium.tenancy.StorageResourceExistsException;
import com.atrium.tenancy.TenantOperationInterruptedException;
import java.util.List;
import java.util.Map;

/**
 * Named, isolated containers of tenant documents.
 * <p>
 * Documents are schemaless maps. Each backend assigns a document identity on insert; that
 * identity is not part of the document content and is regenerated when documents are copied.
 */
public interface TenantStorage {

    /** Name of the identity field, excluded from {@link #documents(String)}. */
    String IDENTITY_FIELD = "_id";

    /**
     * Creates the resource and writes the sentinel document.
     *
     * @throws StorageResourceExistsException if the resource already exists
     */
    void provision(String resourceName, StorageMarker marker);

    boolean exists(String resourceName);

    /**
     * Creates {@code target} and copies every document of {@code source} into it one at a time,
     * dropping document identity. A missing source copies nothing.
     *
     * @return number of documents copied
     * @throws StorageResourceExistsException      if {@code target} already exists
     * @throws TenantOperationInterruptedException if the calling thread is interrupted between
     *                                             documents; the partial target is kept
     */
    long copyDocuments(String source, String target);

    /** Drops the resource and all its documents. No-op when absent. */
    void destroy(String resourceName);

    /** Names of all tenant storage resources, sorted. */
    List<String> listResources();

    void insertDocument(String resourceName, Map<String, Object> document);

    /** Document contents without identity, in insertion order. Empty when the resource is absent. */
    List<Map<String, Object>> documents(String resourceName);

    long countDocuments(String resourceName);
}

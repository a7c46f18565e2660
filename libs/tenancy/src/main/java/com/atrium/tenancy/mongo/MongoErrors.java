package com.atrium.tenancy.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoWriteException;

final class MongoErrors {

    /** Server error code for creating a collection that already exists. */
    static final int NAMESPACE_EXISTS = 48;

    private MongoErrors() {
    }

    static boolean isDuplicateKey(MongoWriteException e) {
        return ErrorCategory.fromErrorCode(e.getError().getCode()) == ErrorCategory.DUPLICATE_KEY;
    }

    static boolean isNamespaceExists(MongoCommandException e) {
        return e.getErrorCode() == NAMESPACE_EXISTS;
    }
}

package io.invsync.core.wire;

import java.util.List;

/** JSON body for GET /query/{collectionPath}. */
public class QueryResponse {
    public List<DocumentResponse> documents;
}

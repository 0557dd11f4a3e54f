package io.invsync.core.wire;

import java.util.List;

/**
 * JSON body for POST /commit.
 * Example:
 *   {
 *     "opId": "4f1c...",
 *     "writes": [
 *       { "op": "set", "path": "groups/g1/items/i1", "fields": {"quantity": 3}, "merge": true },
 *       { "op": "delete", "path": "groups/g1/items/i2" }
 *     ]
 *   }
 */
public class CommitRequest {
    public String opId;   // client-generated idempotency key
    public List<WriteRequest> writes;

    public static class WriteRequest {
        public String op;                   // "set" | "delete"
        public String path;
        public java.util.Map<String, Object> fields;
        public boolean merge;
    }
}

package io.invsync.core.wire;

import java.util.Map;

/**
 * JSON body for GET /docs/{path}, also used for each element of a query page.
 * Example:
 *   {
 *     "path": "groups/g1/items/i1",
 *     "exists": true,
 *     "updateTime": "2026-01-01T10:00:00Z",
 *     "fields": { "name": "Bolts", "quantity": 12 }
 *   }
 */
public class DocumentResponse {
    public String path;
    public boolean exists;
    public String updateTime;           // null when exists == false
    public Map<String, Object> fields;  // wire-encoded values
}

////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmux.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deterministic merge of JSON trees used for every configuration layer:
 * <ul>
 *   <li>objects deep-merge key by key,</li>
 *   <li>arrays replace wholesale (never concatenated),</li>
 *   <li>scalars replace.</li>
 * </ul>
 * Inputs are never mutated; the result shares no structure with them.
 */
public final class JsonMerge {

    private JsonMerge() {
        // utility class
    }

    /**
     * Merge {@code override} on top of {@code base}.
     *
     * @param base     base tree, may be {@code null}
     * @param override overriding tree; {@code null} means "absent" and yields a copy of base
     * @return a fresh merged tree, or {@code null} when both inputs are {@code null}
     */
    public static JsonElement deepMerge(JsonElement base, JsonElement override) {
        if (override == null) {
            return base == null ? null : base.deepCopy();
        }
        if (base != null && base.isJsonObject() && override.isJsonObject()) {
            JsonObject baseObject = base.getAsJsonObject();
            JsonObject overrideObject = override.getAsJsonObject();
            JsonObject output = new JsonObject();

            Set<String> keys = new LinkedHashSet<>(baseObject.keySet());
            keys.addAll(overrideObject.keySet());
            for (String key : keys) {
                if (overrideObject.has(key)) {
                    output.add(key, deepMerge(baseObject.get(key), overrideObject.get(key)));
                } else {
                    output.add(key, baseObject.get(key).deepCopy());
                }
            }
            return output;
        }
        return override.deepCopy();
    }

    /** Object-typed convenience overload; absent objects are treated as empty. */
    public static JsonObject deepMerge(JsonObject base, JsonObject override) {
        JsonElement merged = deepMerge((JsonElement) (base != null ? base : new JsonObject()),
                (JsonElement) override);
        return merged.getAsJsonObject();
    }
}

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.domain.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable memory of "always allow" decisions, keyed by command root, file path
 * or tool key. Tools consult and update it from their confirmation logic.
 */
public class Allowlist {

    private final Set<String> entries = ConcurrentHashMap.newKeySet();

    public boolean has(String key) {
        return key != null && entries.contains(key);
    }

    public void add(String key) {
        if (key != null && !key.isBlank()) {
            entries.add(key);
        }
    }

    public boolean remove(String key) {
        return key != null && entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Sorted copy of all entries.
     */
    public List<String> getAll() {
        List<String> all = new ArrayList<>(entries);
        Collections.sort(all);
        return all;
    }
}

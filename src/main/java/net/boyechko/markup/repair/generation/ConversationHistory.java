/*
 * Markup-Repair - Legacy Markup Tree Normalization
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.repair.generation;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only message log for one request. Appends from several threads are safe; each producer's
 * messages keep their relative order.
 */
public final class ConversationHistory {
    private final List<ChatMessage> messages = new ArrayList<>();

    public ConversationHistory() {}

    public ConversationHistory(List<ChatMessage> initial) {
        messages.addAll(initial);
    }

    public synchronized ConversationHistory append(ChatMessage message) {
        messages.add(message);
        return this;
    }

    /** Immutable copy of the messages so far. */
    public synchronized List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized ChatMessage last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}

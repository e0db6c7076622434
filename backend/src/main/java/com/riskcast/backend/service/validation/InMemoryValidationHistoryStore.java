package com.riskcast.backend.service.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

public class InMemoryValidationHistoryStore implements ValidationHistoryStore {

    private final int capacity;
    private final Deque<ValidationResult> runs = new ArrayDeque<>();

    public InMemoryValidationHistoryStore(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public synchronized void append(ValidationResult result) {
        runs.addFirst(result);
        while (runs.size() > capacity) {
            runs.removeLast();
        }
    }

    @Override
    public synchronized List<ValidationResult> recent(int limit) {
        List<ValidationResult> latest = new ArrayList<>(Math.min(limit, runs.size()));
        Iterator<ValidationResult> iterator = runs.iterator();
        while (iterator.hasNext() && latest.size() < limit) {
            latest.add(iterator.next());
        }
        return latest;
    }
}

package io.github.samzhu.points.support;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import io.github.samzhu.points.port.EventEmitter;

public class RecordingEventEmitter implements EventEmitter {

    public record Emitted(String name, Map<String, Object> payload) {
    }

    private final List<Emitted> events = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public void emit(String eventName, Map<String, Object> payload) {
        if (failure != null) {
            throw failure;
        }
        events.add(new Emitted(eventName, payload));
    }

    public List<Emitted> events() {
        return events;
    }

    public List<Emitted> named(String eventName) {
        return events.stream().filter(e -> e.name().equals(eventName)).toList();
    }
}

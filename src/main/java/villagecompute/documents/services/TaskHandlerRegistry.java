/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.documents.jobs.TaskHandler;
import villagecompute.documents.jobs.TaskType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping {@link TaskType} to its {@link TaskHandler}.
 *
 * <p>
 * Populated once at startup from all CDI-managed handler beans. Task types without a handler are legal: tasks of those
 * types are accepted and then fail at execution time with "Unsupported task type".
 */
@ApplicationScoped
public class TaskHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(TaskHandlerRegistry.class);

    private final Map<TaskType, TaskHandler> handlers;

    @Inject
    public TaskHandlerRegistry(Instance<TaskHandler> handlers) {
        this((Iterable<TaskHandler>) handlers);
    }

    public TaskHandlerRegistry(Iterable<TaskHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(buildRegistry(handlers));
        LOG.infof("Initialized TaskHandlerRegistry with %d registered handlers", this.handlers.size());
    }

    /**
     * Builds a type → handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same TaskType
     */
    private static Map<TaskType, TaskHandler> buildRegistry(Iterable<TaskHandler> handlers) {
        Map<TaskType, TaskHandler> registry = new EnumMap<>(TaskType.class);
        for (TaskHandler handler : handlers) {
            TaskType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for TaskType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for TaskType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    public Optional<TaskHandler> find(TaskType type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean isRegistered(TaskType type) {
        return type != null && handlers.containsKey(type);
    }

    public int size() {
        return handlers.size();
    }
}

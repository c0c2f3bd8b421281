package com.trellissystems.work;

import com.trellissystems.Element;
import com.trellissystems.ItemExistsException;
import com.trellissystems.ItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups named {@link WorkFunction}s that are forwarded and stopped together.
 */
public class Worker extends Element {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final Map<String, WorkFunction> functions = new LinkedHashMap<>();

    public Worker(String name) {
        this.name = name;
    }

    public synchronized Worker register(WorkFunction function) {
        if (functions.containsKey(function.getName())) {
            throw new ItemExistsException(function.getName());
        }
        functions.put(function.getName(), function);
        return this;
    }

    public synchronized WorkFunction get(String functionName) {
        WorkFunction function = functions.get(functionName);
        if (function == null) {
            throw new ItemNotFoundException(functionName, "No work function " + functionName + " on worker " + name);
        }
        return function;
    }

    public synchronized List<WorkFunction> getFunctions() {
        return List.copyOf(functions.values());
    }

    public Work submit(String functionName, Map<String, Object> arguments) {
        return get(functionName).submit(arguments);
    }

    /**
     * Forwards every function once.
     *
     * @return true if any function still has unfinished calls
     */
    public boolean forward() {
        boolean progressable = false;
        for (WorkFunction function : getFunctions()) {
            progressable |= function.forward();
        }
        return progressable;
    }

    public boolean isProgressable() {
        for (WorkFunction function : getFunctions()) {
            if (function.isProgressable()) {
                return true;
            }
        }
        return false;
    }

    public void stop() {
        logger.info("Stopping worker {}", name);
        List<String> running = new ArrayList<>();
        for (WorkFunction function : getFunctions()) {
            function.stop();
            if (!function.getWorkLog().isStopped()) {
                running.add(function.getName());
            }
        }
        if (!running.isEmpty()) {
            logger.error("Could not stop work functions {} on worker {}", running, name);
        }
        logger.info("Stopped worker {}", name);
    }

    public String getName() {
        return name;
    }
}

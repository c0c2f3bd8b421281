package com.trellissystems.executor;

import com.trellissystems.mailbox.Actor;
import com.trellissystems.mailbox.MailManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Drives a workflow by hand: routes mail, then steps every executor once, until done.
 *
 * <p>Usage:
 * <pre>{@code
 * WorkflowDriver driver = new WorkflowDriver()
 *         .register(structure)
 *         .register(branch);
 * branch.requestStart(structure.getId());
 * driver.runToCompletion(100);
 * }</pre>
 */
public class WorkflowDriver {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowDriver.class);

    private final MailManager mailManager;
    private final List<AbstractExecutor> executors = new ArrayList<>();

    public WorkflowDriver() {
        this(new MailManager());
    }

    public WorkflowDriver(MailManager mailManager) {
        this.mailManager = mailManager;
    }

    /**
     * Registers an executor with the mail manager and the step cycle.
     *
     * @param executor the executor
     * @return This WorkflowDriver instance
     */
    public WorkflowDriver register(AbstractExecutor executor) {
        mailManager.addSource(executor);
        executors.add(executor);
        return this;
    }

    /**
     * Registers an actor that only exchanges mail, such as a client or a probe.
     *
     * @param actor the actor
     * @return This WorkflowDriver instance
     */
    public WorkflowDriver addActor(Actor actor) {
        mailManager.addSource(actor);
        return this;
    }

    public MailManager getMailManager() {
        return mailManager;
    }

    /**
     * Collects and delivers all mail, then steps every executor that is still running.
     */
    public void step() {
        mailManager.collectAll();
        mailManager.sendAll();
        for (AbstractExecutor executor : executors) {
            if (!executor.isStopped()) {
                executor.forward();
            }
        }
    }

    /**
     * Steps until a condition holds.
     *
     * @param done      checked after each cycle
     * @param maxCycles upper bound on cycles
     * @return the number of cycles run
     * @throws IllegalStateException if the condition does not hold within the bound
     */
    public int runUntil(BooleanSupplier done, int maxCycles) {
        for (int cycle = 1; cycle <= maxCycles; cycle++) {
            step();
            if (done.getAsBoolean()) {
                logger.info("Workflow completed after {} cycles", cycle);
                return cycle;
            }
        }
        throw new IllegalStateException("Workflow did not complete within " + maxCycles + " cycles");
    }

    /**
     * Steps until every registered executor stopped.
     *
     * @param maxCycles upper bound on cycles
     * @return the number of cycles run
     */
    public int runToCompletion(int maxCycles) {
        return runUntil(() -> executors.stream().allMatch(AbstractExecutor::isStopped), maxCycles);
    }
}

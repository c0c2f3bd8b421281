package com.trellissystems.executor;

import com.trellissystems.ItemNotFoundException;
import com.trellissystems.config.ExecutorConfig;
import com.trellissystems.graph.Node;
import com.trellissystems.mailbox.Actor;
import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailCategory;
import com.trellissystems.mailbox.MailManager;
import com.trellissystems.mailbox.MailPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs a set of branches against one structure and fans traversals out.
 *
 * <p>Each {@code START} mail creates a branch and starts a traversal on its behalf. Mail from the
 * structure is relayed to the branch named by its request source, through an internal
 * {@link MailManager} and a transfer actor; mail from the branches is readdressed to the
 * structure. A {@code NODE_LIST} continues the requesting branch with the first node and clones
 * that branch for every other node.
 *
 * <p>Once every branch acknowledged its {@code END}, the coordinator sends {@code END} to the
 * structure, stops and completes {@link #getCompletion()}.
 */
public class BranchCoordinator extends AbstractExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BranchCoordinator.class);

    private final String structureId;
    private final Supplier<BranchExecutor> branchFactory;
    private final Map<String, BranchExecutor> branches = new LinkedHashMap<>();
    private final Set<String> endedBranches = new HashSet<>();
    private final TransferStation transfer = new TransferStation();
    private final MailManager branchMail;
    private final CompletableFuture<List<BranchExecutor>> completion = new CompletableFuture<>();

    private static final class TransferStation extends Actor {
    }

    public BranchCoordinator(String structureId, Supplier<BranchExecutor> branchFactory) {
        this(structureId, branchFactory, new ExecutorConfig());
    }

    public BranchCoordinator(String structureId, Supplier<BranchExecutor> branchFactory, ExecutorConfig config) {
        super(config);
        this.structureId = structureId;
        this.branchFactory = Objects.requireNonNull(branchFactory, "branchFactory cannot be null");
        this.branchMail = new MailManager(List.of(transfer));
    }

    public String getStructureId() {
        return structureId;
    }

    public synchronized List<BranchExecutor> getBranches() {
        return List.copyOf(branches.values());
    }

    /**
     * Returns a future completed with every branch once all of them ended.
     *
     * @return the completion future
     */
    public CompletableFuture<List<BranchExecutor>> getCompletion() {
        return completion;
    }

    @Override
    protected synchronized void step() {
        transferIns();
        transferOuts();
        branchMail.collectAll();
        branchMail.sendAll();
        for (BranchExecutor branch : List.copyOf(branches.values())) {
            if (branch.getMailbox().hasInbound() || branch.hasPendingFailure()) {
                branch.forward();
            }
        }
    }

    private void transferIns() {
        for (Mail mail : getMailbox().drainInbound()) {
            try {
                switch (mail.getCategory()) {
                    case START -> startBranch((MailPackage.Start) mail.getPackage());
                    case NODE_LIST -> fanOut((MailPackage.NodeListDelivery) mail.getPackage());
                    case NODE, CONDITION, END -> relayToBranch(mail);
                    case NODE_ID -> throw new IllegalArgumentException("Invalid mail type for coordinator: NODE_ID");
                }
            } catch (RuntimeException e) {
                throw traversalError(mail, e);
            }
        }
    }

    private void transferOuts() {
        for (Mail mail : transfer.getMailbox().drainInbound()) {
            if (mail.getCategory() != MailCategory.END) {
                send(structureId, mail.getPackage());
                continue;
            }
            endedBranches.add(mail.getSender());
            logger.debug("Branch {} ended ({} of {})", mail.getSender(), endedBranches.size(), branches.size());
            if (endedBranches.size() == branches.size()) {
                send(structureId, mail.getPackage());
                stop();
                logger.info("Coordinator {} completed with {} branches", getId(), branches.size());
                completion.complete(List.copyOf(branches.values()));
            }
        }
    }

    private void startBranch(MailPackage.Start start) {
        BranchExecutor branch = register(branchFactory.get());
        branch.getContext().putAll(start.context());
        send(structureId, new MailPackage.Start(branch.getId(), start.context()));
        logger.debug("Coordinator {} started branch {}", getId(), branch.getId());
    }

    private void fanOut(MailPackage.NodeListDelivery delivery) {
        String sourceId = delivery.requestSource();
        BranchExecutor source = requireBranch(sourceId);
        List<Node> nodes = delivery.nodes();
        transfer.send(sourceId, new MailPackage.NodeDelivery(sourceId, nodes.get(0)));
        for (Node node : nodes.subList(1, nodes.size())) {
            BranchExecutor clone = register(source.cloneBranch());
            transfer.send(clone.getId(), new MailPackage.NodeDelivery(sourceId, node));
        }
        logger.debug("Coordinator {} fanned out {} nodes from branch {}", getId(), nodes.size(), sourceId);
    }

    private void relayToBranch(Mail mail) {
        String branchId = mail.getPackage().requestSource();
        requireBranch(branchId);
        transfer.send(branchId, mail.getPackage());
    }

    private BranchExecutor register(BranchExecutor branch) {
        branches.put(branch.getId(), branch);
        branchMail.addSource(branch);
        return branch;
    }

    private BranchExecutor requireBranch(String branchId) {
        BranchExecutor branch = branches.get(branchId);
        if (branch == null) {
            throw new ItemNotFoundException(branchId, "Branch " + branchId + " is not managed by coordinator " + getId());
        }
        return branch;
    }
}

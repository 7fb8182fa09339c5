package com.sprintsync.workflow;

import com.sprintsync.workflow.config.WorkflowProperties;
import com.sprintsync.workflow.error.ConcurrentTransitionException;
import com.sprintsync.workflow.error.CrossOrgReferenceException;
import com.sprintsync.workflow.error.DuplicateEdgeException;
import com.sprintsync.workflow.error.DuplicateStatusNameException;
import com.sprintsync.workflow.error.IllegalTransitionException;
import com.sprintsync.workflow.error.InactiveStatusException;
import com.sprintsync.workflow.error.UnknownStatusException;
import com.sprintsync.workflow.error.WorkflowPersistenceException;
import com.sprintsync.workflow.model.AuditRecord;
import com.sprintsync.workflow.model.Task;
import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.repository.TaskRepository;
import com.sprintsync.workflow.service.AuditLog;
import com.sprintsync.workflow.service.OrganizationService;
import com.sprintsync.workflow.service.StatusCatalog;
import com.sprintsync.workflow.service.StatusUpdate;
import com.sprintsync.workflow.service.TaskService;
import com.sprintsync.workflow.service.TransitionExecutor;
import com.sprintsync.workflow.service.TransitionGraph;
import com.sprintsync.workflow.service.WorkflowSetup;
import com.sprintsync.workflow.service.WorkflowSetup.EdgeDefinition;
import com.sprintsync.workflow.service.WorkflowSetup.StatusDefinition;
import com.sprintsync.workflow.service.WorkflowSetupService;
import com.sprintsync.workflow.service.WorkflowView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * End-to-end tests against H2 in PostgreSQL mode with the Flyway schema.
 *
 * Every test works in its own freshly created organization, so tests share
 * the database without cleaning up after each other.
 */
@SpringBootTest
@ActiveProfiles("test")
class WorkflowEngineIntegrationTest {

    private static final Long ACTOR = 7L;

    @Autowired OrganizationService  organizations;
    @Autowired StatusCatalog        catalog;
    @Autowired TransitionGraph      graph;
    @Autowired WorkflowSetupService setupService;
    @Autowired TaskService          taskService;
    @Autowired TransitionExecutor   executor;
    @Autowired TaskRepository       taskRepository;
    @Autowired PlatformTransactionManager transactionManager;
    @Autowired WorkflowProperties   properties;
    @MockitoSpyBean AuditLog        auditLog;

    Long orgId;

    @BeforeEach
    void setUp() {
        orgId = newOrganization();
    }

    // ------------------------------------------------------------------
    // New -> InProgress -> Done
    // ------------------------------------------------------------------

    @Test
    void basicWorkflow_movesAlongEdgesAndRecordsEachMove() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        Task task = taskService.create(orgId, "Ship onboarding flow", ACTOR);
        assertThat(task.getCurrentStatusId()).isEqualTo(ids.get("New"));
        assertThat(auditLog.history(task.getId())).isEmpty();

        assertThatThrownBy(() -> executor.applyTransition(task.getId(), ids.get("Done"), ACTOR, null))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(taskService.get(task.getId()).getCurrentStatusId()).isEqualTo(ids.get("New"));

        executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, "started");
        executor.applyTransition(task.getId(), ids.get("Done"), ACTOR, null);

        List<AuditRecord> history = auditLog.history(task.getId());
        assertThat(history).extracting(AuditRecord::getFromStatusId)
                .containsExactly(ids.get("New"), ids.get("InProgress"));
        assertThat(history).extracting(AuditRecord::getToStatusId)
                .containsExactly(ids.get("InProgress"), ids.get("Done"));
        assertThat(history.get(0).getNotes()).isEqualTo("started");
        assertThat(taskService.get(task.getId()).getCurrentStatusId()).isEqualTo(ids.get("Done"));
        assertThat(taskService.listByStatus(orgId, "Done")).extracting(Task::getId).containsExactly(task.getId());
        assertThat(taskService.nextStatuses(task.getId())).isEmpty();
    }

    @Test
    void auditHistory_isChainedAcrossCycles() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        graph.addEdge(orgId, ids.get("Done"), ids.get("New"));
        Task task = taskService.create(orgId, "Recurring chore", ACTOR);

        for (int lap = 0; lap < 3; lap++) {
            executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, null);
            executor.applyTransition(task.getId(), ids.get("Done"), ACTOR, null);
            executor.applyTransition(task.getId(), ids.get("New"), ACTOR, null);
        }

        List<AuditRecord> history = auditLog.history(task.getId());
        assertThat(history).hasSize(9);
        for (int k = 0; k + 1 < history.size(); k++) {
            assertThat(history.get(k + 1).getFromStatusId()).isEqualTo(history.get(k).getToStatusId());
            assertThat(history.get(k + 1).getChangedAt()).isAfterOrEqualTo(history.get(k).getChangedAt());
        }
        assertThat(history.get(history.size() - 1).getToStatusId())
                .isEqualTo(taskService.get(task.getId()).getCurrentStatusId());
    }

    @Test
    void taskWithoutDefault_firstMoveMayEnterAnyActiveStatus() {
        TaskStatus review = catalog.createStatus(orgId, "Review", null, null, 0, false);
        Task task = taskService.create(orgId, "Unsorted", ACTOR);
        assertThat(task.getCurrentStatusId()).isNull();

        AuditRecord first = executor.applyTransition(task.getId(), review.getId(), ACTOR, null);

        assertThat(first.getFromStatusId()).isNull();
        assertThat(first.getToStatusId()).isEqualTo(review.getId());
    }

    // ------------------------------------------------------------------
    // Catalog and graph invariants
    // ------------------------------------------------------------------

    @Test
    void defaultStatus_isUniquePerOrganization() {
        catalog.createStatus(orgId, "Backlog", null, null, 0, true);
        catalog.createStatus(orgId, "Todo", null, null, 1, true);
        TaskStatus doing = catalog.createStatus(orgId, "Doing", null, null, 2, false);
        catalog.updateStatus(orgId, doing.getId(),
                new StatusUpdate(null, null, null, null, true));

        assertThat(catalog.listAll(orgId)).filteredOn(TaskStatus::isDefaultStatus)
                .extracting(TaskStatus::getName)
                .containsExactly("Doing");
        assertThat(catalog.getDefaultStatus(orgId)).map(TaskStatus::getId).contains(doing.getId());
    }

    @Test
    void statusNames_areUniqueWithinButNotAcrossOrganizations() {
        catalog.createStatus(orgId, "Done", null, null, 0, false);
        Long otherOrg = newOrganization();

        assertThatThrownBy(() -> catalog.createStatus(orgId, "Done", null, null, 1, false))
                .isInstanceOf(DuplicateStatusNameException.class);
        assertThat(catalog.createStatus(otherOrg, "Done", null, null, 0, false).getId()).isNotNull();
    }

    @Test
    void addEdge_twice_leavesOneActiveEdge() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        int before = graph.listEdges(orgId).size();

        assertThatThrownBy(() -> graph.addEdge(orgId, ids.get("New"), ids.get("InProgress")))
                .isInstanceOf(DuplicateEdgeException.class);
        graph.deactivateEdge(orgId, ids.get("New"), ids.get("InProgress"));
        graph.addEdge(orgId, ids.get("New"), ids.get("InProgress"));

        assertThat(graph.listEdges(orgId)).hasSize(before);
        assertThat(graph.isAllowed(orgId, ids.get("New"), ids.get("InProgress"))).isTrue();
    }

    @Test
    void deactivatedEdge_blocksMoves() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        Task task = taskService.create(orgId, "Blocked by policy", ACTOR);
        graph.deactivateEdge(orgId, ids.get("New"), ids.get("InProgress"));

        assertThatThrownBy(() -> executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, null))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(taskService.nextStatuses(task.getId())).isEmpty();
    }

    @Test
    void deactivatedStatus_keepsTasksButRejectsNewArrivals() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        Task parked = taskService.create(orgId, "Already in progress", ACTOR);
        executor.applyTransition(parked.getId(), ids.get("InProgress"), ACTOR, null);
        Task fresh = taskService.create(orgId, "Not started", ACTOR);

        catalog.deactivate(ids.get("InProgress"));

        assertThatThrownBy(() -> executor.applyTransition(fresh.getId(), ids.get("InProgress"), ACTOR, null))
                .isInstanceOf(InactiveStatusException.class);
        assertThat(executor.applyTransition(parked.getId(), ids.get("Done"), ACTOR, null).getToStatusId())
                .isEqualTo(ids.get("Done"));
        assertThat(catalog.listActive(orgId)).extracting(TaskStatus::getName).containsExactly("New", "Done");
    }

    // ------------------------------------------------------------------
    // Organization isolation
    // ------------------------------------------------------------------

    @Test
    void crossOrganizationReferences_areRejected() {
        Map<String, Long> mine = installBasicWorkflow(orgId);
        Long otherOrg = newOrganization();
        Map<String, Long> theirs = installBasicWorkflow(otherOrg);
        Task task = taskService.create(orgId, "Stay home", ACTOR);

        assertThatThrownBy(() -> graph.addEdge(orgId, mine.get("New"), theirs.get("Done")))
                .isInstanceOf(CrossOrgReferenceException.class);
        assertThatThrownBy(() -> executor.applyTransition(task.getId(), theirs.get("InProgress"), ACTOR, null))
                .isInstanceOf(UnknownStatusException.class);
        assertThat(auditLog.history(task.getId())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Atomicity
    // ------------------------------------------------------------------

    @Test
    void auditFailure_rollsBackStatusChange() {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        Task task = taskService.create(orgId, "Doomed move", ACTOR);
        doThrow(new DataIntegrityViolationException("audit insert failed")).when(auditLog).append(any());

        assertThatThrownBy(() -> executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, null))
                .isInstanceOf(WorkflowPersistenceException.class);

        assertThat(taskService.get(task.getId()).getCurrentStatusId()).isEqualTo(ids.get("New"));
        assertThat(auditLog.history(task.getId())).isEmpty();
    }

    @Test
    void bulkSetup_failureCreatesNothing() {
        WorkflowSetup broken = new WorkflowSetup(
                List.of(new StatusDefinition("New", null, null, 0, true),
                        new StatusDefinition("Done", null, null, 1, false)),
                List.of(new EdgeDefinition("New", "Done"),
                        new EdgeDefinition("Done", "Ghost")));

        assertThatThrownBy(() -> setupService.setup(orgId, broken)).isInstanceOf(UnknownStatusException.class);

        WorkflowView view = setupService.view(orgId);
        assertThat(view.statuses()).isEmpty();
        assertThat(view.transitions()).isEmpty();
        assertThat(catalog.listActive(orgId)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentMovesFromSameStatus_exactlyOneWins() throws Exception {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        TaskStatus blocked = catalog.createStatus(orgId, "Blocked", null, null, 3, false);
        graph.addEdge(orgId, ids.get("New"), blocked.getId());
        Task task = taskService.create(orgId, "Contended", ACTOR);

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<AuditRecord>> futures = new ArrayList<>();
        try {
            for (Long target : List.of(ids.get("InProgress"), blocked.getId())) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return executor.applyTransition(task.getId(), target, ACTOR, null);
                }));
            }
            start.countDown();

            int successes = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<AuditRecord> f : futures) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(failures).hasSize(1);
            assertThat(failures.get(0))
                    .isInstanceOfAny(IllegalTransitionException.class, ConcurrentTransitionException.class);
        } finally {
            pool.shutdownNow();
        }

        List<AuditRecord> history = auditLog.history(task.getId());
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getFromStatusId()).isEqualTo(ids.get("New"));
        assertThat(taskService.get(task.getId()).getCurrentStatusId()).isEqualTo(history.get(0).getToStatusId());
    }

    @Test
    void moveWhileAnotherTransactionHoldsTheTask_retriesThenReportsContention() throws Exception {
        Map<String, Long> ids = installBasicWorkflow(orgId);
        Task task = taskService.create(orgId, "Held elsewhere", ACTOR);
        WorkflowProperties.Transition cfg = properties.getTransition();

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(s -> {
                taskRepository.lockById(task.getId()).orElseThrow();
                held.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(10, TimeUnit.SECONDS)).isTrue();

            long started = System.nanoTime();
            assertThatThrownBy(() -> executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, null))
                    .isInstanceOfSatisfying(ConcurrentTransitionException.class,
                            e -> assertThat(e.retryable()).isTrue());
            assertThat(Duration.ofNanos(System.nanoTime() - started))
                    .isGreaterThanOrEqualTo(cfg.getLockTimeout().multipliedBy(cfg.getMaxAttempts()));
            assertThat(auditLog.history(task.getId())).isEmpty();

            release.countDown();
            holder.get(30, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        // Same pool, same connections: the failed attempts left nothing broken behind.
        executor.applyTransition(task.getId(), ids.get("InProgress"), ACTOR, null);
        assertThat(auditLog.history(task.getId())).extracting(AuditRecord::getToStatusId)
                .containsExactly(ids.get("InProgress"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Long newOrganization() {
        return organizations.create("org-" + UUID.randomUUID(), null).getId();
    }

    private Map<String, Long> installBasicWorkflow(Long org) {
        WorkflowView view = setupService.setup(org, new WorkflowSetup(
                List.of(new StatusDefinition("New", null, "#9CA3AF", 0, true),
                        new StatusDefinition("InProgress", "In Progress", "#3B82F6", 1, false),
                        new StatusDefinition("Done", null, "#22C55E", 2, false)),
                List.of(new EdgeDefinition("New", "InProgress"),
                        new EdgeDefinition("InProgress", "Done"))));
        return view.statuses().stream()
                .collect(Collectors.toMap(TaskStatus::getName, TaskStatus::getId));
    }
}

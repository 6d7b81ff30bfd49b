package com.devflow.core.monitoring;

import com.devflow.core.config.MonitoringProperties;
import com.devflow.core.events.EventChannel;
import com.devflow.core.events.Subscription;
import com.devflow.core.git.GitStatusProvider;
import com.devflow.core.logging.MdcContext;
import com.devflow.core.model.Commit;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.UncommittedChanges;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Fans file changes, git state and conversation events into one stream per project.
 * <p>
 * Work for a project runs on a serial lane: events of one project are delivered in the
 * order they were observed, while a slow git call for one project does not hold up the
 * others. The file watcher, git collaborator and decision loop are optional.
 */
@Service
public class MonitorManager {

    private static final Logger log = LoggerFactory.getLogger(MonitorManager.class);

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "ts", "tsx", "js", "jsx", "py", "go", "rs", "rb", "cs");
    private static final List<String> SOURCE_DIRECTORIES = List.of("src/", "lib/", "components/", "features/");

    private final FileWatcher fileWatcher;
    private final GitStatusProvider gitStatusProvider;
    private final ConversationMonitor conversationMonitor;
    private final EventAggregator aggregator;
    private final DecisionLoop decisionLoop;
    private final MonitoringProperties properties;
    private final Executor executor;
    private final Clock clock;

    private final EventChannel<MonitoringEvent> events =
            new EventChannel<>("monitor-events", MonitoringEvent::projectPath);
    private final Map<String, String> gitStateHashes = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile boolean started;
    private volatile boolean fileWatcherAttached;
    private volatile String activeProject;

    @Autowired
    public MonitorManager(@Autowired(required = false) FileWatcher fileWatcher,
                          @Autowired(required = false) GitStatusProvider gitStatusProvider,
                          ConversationMonitor conversationMonitor,
                          EventAggregator aggregator,
                          @Autowired(required = false) DecisionLoop decisionLoop,
                          MonitoringProperties properties,
                          @Qualifier("devflowExecutor") Executor executor,
                          Clock clock) {
        this.fileWatcher = fileWatcher;
        this.gitStatusProvider = gitStatusProvider;
        this.conversationMonitor = conversationMonitor;
        this.aggregator = aggregator;
        this.decisionLoop = decisionLoop;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public EventChannel<MonitoringEvent> events() {
        return events;
    }

    public EventAggregator aggregator() {
        return aggregator;
    }

    @PostConstruct
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;

        if (fileWatcher != null) {
            subscriptions.add(fileWatcher.addChangeListener(this::onFileChange));
            fileWatcherAttached = true;
        } else {
            log.info("No file watcher available, file changes will not be monitored");
        }
        conversationMonitor.start();
        subscriptions.add(conversationMonitor.events().subscribeAll(this::onConversationEvent));

        if (gitStatusProvider == null) {
            log.info("No git status provider available, git state will not be monitored");
        }
        refreshAll();
        log.info("Monitoring started for {} project(s)", properties.getProjects().size());
    }

    /**
     * Releases every listener and clears buffered state. Safe to call repeatedly or before {@link #start()}.
     */
    @PreDestroy
    public synchronized void stop() {
        for (Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        fileWatcherAttached = false;

        conversationMonitor.stop();
        aggregator.clear();
        gitStateHashes.clear();
        lanes.clear();
        events.clear();

        if (started) {
            log.info("Monitoring stopped");
        }
        started = false;
    }

    /**
     * Sets the project that conversation events are attributed to.
     */
    public void setActiveProject(String projectPath) {
        this.activeProject = projectPath;
    }

    /**
     * The project conversation events are attributed to: the explicitly set project, else the
     * project of the most recent file change, else the first configured project.
     */
    public String getActiveProject() {
        if (activeProject != null) {
            return activeProject;
        }
        List<MonitoringProperties.Project> projects = properties.getProjects();
        return projects.isEmpty() ? "" : projects.get(0).getPath();
    }

    /**
     * Forwards narrated text to the conversation monitor. Resulting events are attributed
     * to the active project and re-emitted on {@link #events()}.
     */
    public void processConversationMessage(String message, String role) {
        conversationMonitor.processMessage(message, role);
    }

    /** Re-checks git state of every configured project. */
    public void refreshAll() {
        if (gitStatusProvider == null) {
            return;
        }
        for (MonitoringProperties.Project project : properties.getProjects()) {
            String path = project.getPath();
            submit(path, () -> checkGitState(path));
        }
    }

    public MonitoringState getMonitoringState() {
        return new MonitoringState(
                List.copyOf(properties.getProjects()),
                new MonitoringState.ActiveMonitors(
                        fileWatcherAttached,
                        started && gitStatusProvider != null,
                        conversationMonitor.isActive()),
                aggregator.getStats(),
                aggregator.getRecentEvents(10));
    }

    // ---- Inputs ----

    void onFileChange(FileChangeEvent change) {
        String projectPath = change.projectPath();
        activeProject = projectPath;
        MonitoringEvent event = MonitoringEvent.fileChange(projectPath, change.filePath(), change.eventType(),
                change.timestamp() != null ? change.timestamp() : clock.instant());
        submit(projectPath, () -> {
            emit(event);
            if (isSignificant(change.filePath())) {
                checkGitState(projectPath);
            }
        });
    }

    private void onConversationEvent(MonitoringEvent event) {
        String projectPath = getActiveProject();
        MonitoringEvent attributed = event.withProjectPath(projectPath);
        submit(projectPath, () -> emit(attributed));
    }

    // ---- Pipeline ----

    private void emit(MonitoringEvent event) {
        aggregator.addEvent(event);
        events.publish(event);
        if (decisionLoop != null) {
            decisionLoop.onEvent(event);
        }
    }

    private void checkGitState(String projectPath) {
        if (gitStatusProvider == null) {
            return;
        }
        MdcContext.setProject(projectPath);
        try {
            String branch = gitStatusProvider.getCurrentBranch(projectPath);
            UncommittedChanges changes = gitStatusProvider.getUncommittedChanges(projectPath).orElse(null);
            List<Commit> commits = gitStatusProvider.getRecentCommits(projectPath, 1);
            Commit latest = commits.isEmpty() ? null : commits.get(0);

            String hash = branch + "|" + (changes != null ? changes.fileCount() : 0) + "|"
                    + (latest != null ? latest.hash() : "");
            String previous = gitStateHashes.put(projectPath, hash);
            if (hash.equals(previous)) {
                return;
            }
            log.debug("Git state changed for {}: {}", projectPath, hash);
            emit(MonitoringEvent.gitStateChange(projectPath, branch, changes, latest, clock.instant()));
        } catch (Exception e) {
            log.warn("Error checking git state for {}: {}", projectPath, e.getMessage());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Appends a task to the project's serial lane.
     */
    private void submit(String projectPath, Runnable task) {
        lanes.compute(projectPath, (key, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> runSafely(projectPath, task), executor);
        });
    }

    private void runSafely(String projectPath, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Monitoring task failed for {}: {}", projectPath, e.getMessage(), e);
        }
    }

    static boolean isSignificant(String filePath) {
        if (filePath == null) {
            return false;
        }
        String normalized = filePath.replace('\\', '/');
        int dot = normalized.lastIndexOf('.');
        if (dot >= 0 && SOURCE_EXTENSIONS.contains(normalized.substring(dot + 1).toLowerCase(Locale.ROOT))) {
            return true;
        }
        return SOURCE_DIRECTORIES.stream().anyMatch(dir -> normalized.startsWith(dir) || normalized.contains("/" + dir));
    }
}

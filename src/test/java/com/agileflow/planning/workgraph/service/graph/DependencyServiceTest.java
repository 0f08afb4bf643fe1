package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.dto.graph.DependencyGraphResponse;
import com.agileflow.planning.workgraph.dto.graph.GraphNode;
import com.agileflow.planning.workgraph.dto.graph.ImpactResponse;
import com.agileflow.planning.workgraph.dto.graph.WorkItemDependencies;
import com.agileflow.planning.workgraph.exception.CircularDependencyException;
import com.agileflow.planning.workgraph.exception.InvalidDependencyException;
import com.agileflow.planning.workgraph.exception.ResourceNotFoundException;
import com.agileflow.planning.workgraph.model.ActivityEvent;
import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.model.WorkItemType;
import com.agileflow.planning.workgraph.repository.WorkItemRepository;
import com.agileflow.planning.workgraph.service.activity.ActivityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DependencyServiceTest {

    @Mock
    private WorkItemRepository workItemRepository;

    @Mock
    private ActivityService activityService;

    private DependencyService dependencyService;

    private final Map<String, WorkItem> store = new HashMap<>();

    @BeforeEach
    void setUp() {
        dependencyService = new DependencyService(workItemRepository, new DependencyGraphBuilder(),
                new CycleDetector(), new PathAnalyzer(), new ImpactAnalyzer(), activityService);
    }

    @Test
    void addDependency_writesEdgeAndRecordsActivity() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo"));
        stubAddDependency();

        WorkItemDependencies result = dependencyService.addDependency("b", "a", "alice");

        assertThat(result.getDependencies()).containsExactly("a");
        assertThat(result.getUpdatedAt()).isNotNull();
        verify(activityService).record(eq(ActivityEvent.Action.UPDATED), eq("task"), eq("b"), eq("alice"),
                eq("Added dependency \"Task a\" to task \"Task b\""), anyMap());
    }

    @Test
    void addDependency_rejectsSelfDependency() {
        stubStore(task("a", "s1", "todo"));

        assertThatThrownBy(() -> dependencyService.addDependency("a", "a", "alice"))
                .isInstanceOf(CircularDependencyException.class);
        verify(workItemRepository, never()).addDependency(anyString(), anyString(), any());
    }

    @Test
    void addDependency_rejectsEdgeClosingALoop() {
        // c depends on b, b depends on a; a -> c would loop
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo", "a"), task("c", "s1", "todo", "b"));

        assertThatThrownBy(() -> dependencyService.addDependency("a", "c", "alice"))
                .isInstanceOf(CircularDependencyException.class)
                .satisfies(ex -> {
                    CircularDependencyException cycle = (CircularDependencyException) ex;
                    assertThat(cycle.getItemId()).isEqualTo("a");
                    assertThat(cycle.getDependencyId()).isEqualTo("c");
                });
        verify(workItemRepository, never()).addDependency(anyString(), anyString(), any());
        verify(activityService, never()).record(anyString(), anyString(), anyString(), any(), anyString(), anyMap());
    }

    @Test
    void addDependency_rejectsItemsFromAnotherStory() {
        stubStore(task("a", "s1", "todo"), task("b", "s2", "todo"));

        assertThatThrownBy(() -> dependencyService.addDependency("b", "a", "alice"))
                .isInstanceOf(InvalidDependencyException.class)
                .hasMessage("Dependencies must belong to the same story");
    }

    @Test
    void addDependency_rejectsDuplicate() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo", "a"));

        assertThatThrownBy(() -> dependencyService.addDependency("b", "a", "alice"))
                .isInstanceOf(InvalidDependencyException.class)
                .hasMessage("Dependency already exists for this work item");
    }

    @Test
    void addDependency_unknownDependencyIsNotFound() {
        stubStore(task("a", "s1", "todo"));

        assertThatThrownBy(() -> dependencyService.addDependency("a", "ghost", "alice"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void removeDependency_dropsEdge() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo", "a"));
        stubRemoveDependency();

        WorkItemDependencies result = dependencyService.removeDependency("b", "a", "alice");

        assertThat(result.getDependencies()).isEmpty();
        verify(activityService).record(eq(ActivityEvent.Action.UPDATED), eq("task"), eq("b"), eq("alice"),
                eq("Removed dependency \"Task a\" from task \"Task b\""), anyMap());
    }

    @Test
    void removeDependency_missingEdgeIsInvalid() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo"));

        assertThatThrownBy(() -> dependencyService.removeDependency("b", "a", "alice"))
                .isInstanceOf(InvalidDependencyException.class)
                .hasMessage("Dependency not found on work item");
    }

    @Test
    void getDependencyGraph_marksCurrentCriticalAndBlockedNodes() {
        List<WorkItem> tasks = List.of(
                task("a", "s1", "done"),
                task("b", "s1", "todo", "a"),
                task("c", "s1", "todo", "b"));
        stubStore(tasks.toArray(new WorkItem[0]));
        when(workItemRepository.findByTypeAndStoryIdOrderByIdAsc(WorkItemType.TASK, "s1")).thenReturn(tasks);

        DependencyGraphResponse response = dependencyService.getDependencyGraph("b");

        assertThat(response.getScopeType()).isEqualTo("STORY");
        assertThat(response.getCriticalPath()).containsExactly("a", "b", "c");
        assertThat(response.getEdges()).hasSize(2).allMatch(edge -> edge.isCritical());
        assertThat(response.getBlockedItems()).extracting("id").containsExactly("c");
        assertThat(response.getCycles()).isEmpty();
        assertThat(response.getStats().getTotalItems()).isEqualTo(3);
        assertThat(response.getStats().getBlockedItems()).isEqualTo(1);

        GraphNode current = response.getNodes().stream().filter(GraphNode::isCurrent).findFirst().orElseThrow();
        assertThat(current.getId()).isEqualTo("b");
        assertThat(current.isBlocked()).isFalse();
        assertThat(current.getLevel()).isEqualTo(1);
    }

    @Test
    void getDependencyGraph_isIdempotentOnUnchangedScope() {
        List<WorkItem> tasks = List.of(
                task("a", "s1", "todo"),
                task("b", "s1", "todo", "a"),
                task("c", "s1", "todo", "a"),
                task("d", "s1", "todo", "b", "c"));
        stubStore(tasks.toArray(new WorkItem[0]));
        when(workItemRepository.findByTypeAndStoryIdOrderByIdAsc(WorkItemType.TASK, "s1")).thenReturn(tasks);

        DependencyGraphResponse first = dependencyService.getDependencyGraph("a");
        DependencyGraphResponse second = dependencyService.getDependencyGraph("a");

        assertThat(second.getCriticalPath()).isEqualTo(first.getCriticalPath());
        assertThat(second.getBlockedItems()).isEqualTo(first.getBlockedItems());
    }

    @Test
    void getDependencyGraph_reportsCycleWrittenDirectlyToTheStore() {
        List<WorkItem> tasks = List.of(
                task("x", "s1", "todo", "y"),
                task("y", "s1", "todo", "x"),
                task("z", "s1", "todo"));
        stubStore(tasks.toArray(new WorkItem[0]));
        when(workItemRepository.findByTypeAndStoryIdOrderByIdAsc(WorkItemType.TASK, "s1")).thenReturn(tasks);

        DependencyGraphResponse response = dependencyService.getDependencyGraph("z");

        assertThat(response.getCriticalPath()).containsExactly("z");
        assertThat(response.getBlockedItems()).hasSize(2);
        assertThat(response.getCycles()).hasSize(1);
    }

    @Test
    void getProjectDependencyGraph_usesStoriesOfTheProject() {
        WorkItem s1 = story("s1", "p1");
        WorkItem s2 = story("s2", "p1", "s1");
        when(workItemRepository.findByTypeAndProjectIdOrderByIdAsc(WorkItemType.STORY, "p1")).thenReturn(List.of(s1, s2));

        DependencyGraphResponse response = dependencyService.getProjectDependencyGraph("p1");

        assertThat(response.getScopeType()).isEqualTo("PROJECT");
        assertThat(response.getCriticalPath()).containsExactly("s1", "s2");
        assertThat(response.getNodes()).noneMatch(GraphNode::isCurrent);
    }

    @Test
    void getImpact_ofLeafIsEmpty() {
        List<WorkItem> tasks = List.of(task("a", "s1", "todo"), task("b", "s1", "todo", "a"));
        stubStore(tasks.toArray(new WorkItem[0]));
        when(workItemRepository.findByTypeAndStoryIdOrderByIdAsc(WorkItemType.TASK, "s1")).thenReturn(tasks);

        ImpactResponse impact = dependencyService.getImpact("b");

        assertThat(impact.getImpacted()).isEmpty();
        assertThat(impact.getImpactScore()).isZero();
        assertThat(impact.getBlockers()).extracting("id").containsExactly("a");
    }

    @Test
    void activityEventCarriesTheAddedDependency() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo"));
        stubAddDependency();
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);

        dependencyService.addDependency("b", "a", "alice");

        verify(activityService).record(anyString(), anyString(), anyString(), anyString(), anyString(), metadata.capture());
        assertThat(metadata.getValue()).containsEntry("dependencyAdded", "a");
    }

    @Test
    void addDependency_keepsFieldsChangedWhileTheCycleCheckRuns() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "todo"));
        stubAddDependency();
        // another writer closes b while the cycle walk reads a
        when(workItemRepository.findById("a")).thenAnswer(invocation -> {
            store.get("b").setStatus("done");
            return Optional.of(copyOf(store.get("a")));
        });

        WorkItemDependencies result = dependencyService.addDependency("b", "a", "alice");

        assertThat(result.getDependencies()).containsExactly("a");
        assertThat(store.get("b").getStatus()).isEqualTo("done");
        verify(workItemRepository, never()).save(any());
    }

    @Test
    void removeDependency_writesOnlyTheDependencyList() {
        stubStore(task("a", "s1", "todo"), task("b", "s1", "in-progress", "a"));
        stubRemoveDependency();

        dependencyService.removeDependency("b", "a", "alice");

        verify(workItemRepository).removeDependency(eq("b"), eq("a"), any());
        verify(workItemRepository, never()).save(any());
        assertThat(store.get("b").getStatus()).isEqualTo("in-progress");
        assertThat(store.get("b").getDependencies()).isEmpty();
    }

    private void stubStore(WorkItem... items) {
        for (WorkItem item : items) {
            store.put(item.getId(), item);
        }
        when(workItemRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(store.get(invocation.<String>getArgument(0)))
                        .map(DependencyServiceTest::copyOf));
    }

    // Field-level writes against the in-memory store, like $addToSet and $pull
    private void stubAddDependency() {
        when(workItemRepository.addDependency(anyString(), anyString(), any())).thenAnswer(invocation -> {
            WorkItem stored = store.get(invocation.<String>getArgument(0));
            if (stored == null) {
                return false;
            }
            String dependencyId = invocation.getArgument(1);
            if (!stored.getDependencies().contains(dependencyId)) {
                stored.getDependencies().add(dependencyId);
            }
            stored.setUpdatedAt(invocation.getArgument(2));
            return true;
        });
    }

    private void stubRemoveDependency() {
        when(workItemRepository.removeDependency(anyString(), anyString(), any())).thenAnswer(invocation -> {
            WorkItem stored = store.get(invocation.<String>getArgument(0));
            if (stored == null) {
                return false;
            }
            stored.getDependencies().remove(invocation.<String>getArgument(1));
            stored.setUpdatedAt(invocation.getArgument(2));
            return true;
        });
    }

    private static WorkItem copyOf(WorkItem item) {
        return WorkItem.builder()
                .id(item.getId())
                .type(item.getType())
                .title(item.getTitle())
                .status(item.getStatus())
                .priority(item.getPriority())
                .projectId(item.getProjectId())
                .storyId(item.getStoryId())
                .dependencies(new ArrayList<>(item.getDependencies()))
                .storyPoints(item.getStoryPoints())
                .estimatedHours(item.getEstimatedHours())
                .assigneeId(item.getAssigneeId())
                .dueDate(item.getDueDate())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }

    private static WorkItem task(String id, String storyId, String status, String... dependencies) {
        return WorkItem.builder()
                .id(id)
                .type(WorkItemType.TASK)
                .title("Task " + id)
                .status(status)
                .storyId(storyId)
                .dependencies(new ArrayList<>(List.of(dependencies)))
                .build();
    }

    private static WorkItem story(String id, String projectId, String... dependencies) {
        return WorkItem.builder()
                .id(id)
                .type(WorkItemType.STORY)
                .title("Story " + id)
                .status("todo")
                .projectId(projectId)
                .dependencies(new ArrayList<>(List.of(dependencies)))
                .build();
    }
}

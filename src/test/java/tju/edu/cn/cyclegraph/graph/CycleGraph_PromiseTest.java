package tju.edu.cn.cyclegraph.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.anyShort;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

import tju.edu.cn.cyclegraph.trace.ModelAction;
import tju.edu.cn.cyclegraph.trace.Promise;
import tju.edu.cn.cyclegraph.trace.ThreadPromise;

public class CycleGraph_PromiseTest {
    private final CycleGraph graph = new CycleGraph();

    private static ModelAction action(int tid, long seq) {
        return new ModelAction((short) tid, seq);
    }

    @Test
    public void eliminatesWhenLaterActionRunsOnExcludedThread() {
        ModelAction a = action(1, 1);
        ModelAction b = action(2, 2);
        ModelAction c = action(3, 3);
        graph.addEdge(a, b);
        graph.addEdge(b, c);
        Promise promise = mock(Promise.class);
        when(promise.excludesThread((short) 3)).thenReturn(true);

        assertThat(graph.canEliminate(a, promise), is(true));
        assertThat(graph.canEliminate(c, promise), is(true));
    }

    @Test
    public void doesNotEliminateWhenOnlyEarlierActionsAreExcluded() {
        ModelAction a = action(1, 1);
        ModelAction b = action(2, 2);
        graph.addEdge(a, b);
        ThreadPromise promise = new ThreadPromise("p");
        promise.eliminateThread((short) 1);

        assertThat(graph.canEliminate(b, promise), is(false));
        assertThat(graph.canEliminate(a, promise), is(true));
    }

    @Test
    public void startNodeIsTested() {
        ModelAction a = action(4, 1);
        graph.addEdge(a, action(5, 2));
        Promise promise = mock(Promise.class);
        when(promise.excludesThread((short) 4)).thenReturn(true);

        assertThat(graph.canEliminate(a, promise), is(true));
        verify(promise, never()).excludesThread((short) 5);
    }

    @Test
    public void unknownActionCannotEliminate() {
        Promise promise = mock(Promise.class);

        assertThat(graph.canEliminate(action(1, 1), promise), is(false));
        verifyNoInteractions(promise);
    }

    @Test
    public void promiseNodesAreTraversedButNotTested() {
        ModelAction a = action(1, 1);
        ModelAction b = action(2, 2);
        Promise pending = mock(Promise.class);
        graph.addEdge(a, pending);
        graph.addEdge(pending, b);
        Promise promise = mock(Promise.class);
        when(promise.excludesThread((short) 2)).thenReturn(true);

        assertThat(graph.canEliminate(a, promise), is(true));
        verify(promise).excludesThread((short) 1);
        verify(promise).excludesThread((short) 2);
        verifyNoInteractions(pending);
    }

    @Test
    public void noExcludedThreadMeansNoElimination() {
        ModelAction a = action(1, 1);
        graph.addEdge(a, action(2, 2));
        Promise promise = mock(Promise.class);
        when(promise.excludesThread(anyShort())).thenReturn(false);

        assertThat(graph.canEliminate(a, promise), is(false));
    }

    @Test
    public void promiseEdgesParticipateInCyclesAndReachability() {
        ModelAction a = action(1, 1);
        ModelAction b = action(2, 2);
        Promise promise = mock(Promise.class);

        assertThat(graph.addEdge(a, promise), is(true));
        assertThat(graph.addEdge(promise, b), is(true));

        assertThat(graph.reachable(a, promise), is(true));
        assertThat(graph.reachable(promise, b), is(true));
        assertThat(graph.reachable(promise, a), is(false));
        assertThat(graph.reachableFromAction(a, b), is(true));
        assertThat(graph.hasCycles(), is(false));

        graph.addEdge(b, a);

        assertThat(graph.hasCycles(), is(true));
        assertThat(graph.nodeCount(), is(3));
    }

    @Test
    public void unknownPromiseIsNeverReachable() {
        ModelAction a = action(1, 1);
        graph.addEdge(a, action(2, 2));

        assertThat(graph.reachable(a, mock(Promise.class)), is(false));
        assertThat(graph.reachable(mock(Promise.class), a), is(false));
    }

    @Test
    public void promiseEdgesRollBack() {
        ModelAction a = action(1, 1);
        Promise promise = mock(Promise.class);
        graph.startTransaction();
        graph.addEdge(a, promise);

        graph.rollback();

        assertThat(graph.reachable(a, promise), is(false));
        assertThat(graph.edgeCount(), is(0));
    }
}

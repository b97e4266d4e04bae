package work.vaultlogic.sandbox.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BlockContextViewTest {
    @Test
    void scriptShapeOmitsAbsentSectionAndUser() {
        var view = BlockContextView.builder().workflowId("wf").runId("r1").phase("review").build();
        Map<String, Object> shape = view.toScriptContext();
        assertEquals(Map.of("id", "wf"), shape.get("workflow"));
        assertEquals(Map.of("id", "r1"), shape.get("run"));
        assertEquals("review", shape.get("phase"));
        assertFalse(shape.containsKey("section"));
        assertFalse(shape.containsKey("user"));
        assertEquals(Map.of(), shape.get("answers"));
    }

    @Test
    void blankIdsAreTreatedAsAbsent() {
        var view = BlockContextView.builder().sectionId(" ").userId("").build();
        assertEquals(Optional.empty(), view.sectionId());
        assertEquals(Optional.empty(), view.userId());
    }

    @Test
    void readsFlatForm() {
        var view = BlockContextView.fromMap(Map.of("workflowId", "wf", "runId", "r", "phase", "p", "sectionId", "s1",
            "answers", Map.of("q", 1)));
        assertEquals("wf", view.workflowId());
        assertEquals(Optional.of("s1"), view.sectionId());
        assertEquals(Map.of("q", 1), view.answers());
    }

    @Test
    void readsScriptShape() {
        var original = BlockContextView.builder().workflowId("wf").runId("r").phase("p").userId("u").build();
        assertEquals(original, BlockContextView.fromMap(original.toScriptContext()));
    }

    @Test
    void answersAreImmutableCopies() {
        var view = BlockContextView.builder().answers(new java.util.HashMap<>(Map.of("a", 1))).build();
        assertThrows(UnsupportedOperationException.class, () -> view.answers().put("b", 2));
    }
}

package io.hostforge.provisioner.step;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepRegistryTest {

    final StepRegistry<Object> registry = new StepRegistry<>("test", List.of(
            new StubStep("a", true), new StubStep("b", false), new StubStep("c", false)));

    @Test
    void nextIncompleteStep_followsRegistrationOrder() {
        InMemoryJournal journal = new InMemoryJournal();
        assertThat(registry.nextIncompleteStep(journal)).get().extracting(Step::name).isEqualTo("a");

        journal.markStepCompleted("a", Map.of());
        journal.markStepSkipped("b", "not needed");

        assertThat(registry.nextIncompleteStep(journal)).get().extracting(Step::name).isEqualTo("c");
    }

    @Test
    void progress_countsSkippedAsDone() {
        InMemoryJournal journal = new InMemoryJournal();
        journal.markStepCompleted("a", Map.of());
        journal.markStepSkipped("b", "n/a");

        StepRegistry.Progress progress = registry.progress(journal);

        assertThat(progress.done()).isEqualTo(2);
        assertThat(progress.total()).isEqualTo(3);
        assertThat(progress.percentage()).isEqualTo(67);
        assertThat(progress.nextStep()).isEqualTo("c");
        assertThat(registry.canResume(journal)).isTrue();
    }

    @Test
    void canResume_falseWhenNothingOrEverythingIsDone() {
        InMemoryJournal journal = new InMemoryJournal();
        assertThat(registry.canResume(journal)).isFalse();

        registry.stepNames().forEach(name -> journal.markStepCompleted(name, Map.of()));

        assertThat(registry.canResume(journal)).isFalse();
        assertThat(registry.nextIncompleteStep(journal)).isEmpty();
        assertThat(registry.progress(journal).percentage()).isEqualTo(100);
    }

    @Test
    void duplicateNames_areRejected() {
        assertThatThrownBy(() -> new StepRegistry<>("dup", List.of(new StubStep("a", true), new StubStep("a", false))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate step 'a'");
    }

    @Test
    void get_unknownStep_throws() {
        assertThatThrownBy(() -> registry.get("zzz")).isInstanceOf(StepNotFoundException.class);
        assertThat(registry.indexOf("b")).isEqualTo(1);
    }
}

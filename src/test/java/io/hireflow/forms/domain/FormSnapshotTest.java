package io.hireflow.forms.domain;

import static io.hireflow.forms.TestFixtures.NAME_FIELD;
import static io.hireflow.forms.TestFixtures.RECRUITER;
import static io.hireflow.forms.TestFixtures.template;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FormSnapshot")
class FormSnapshotTest {

    @Test
    @DisplayName("snapshot is decoupled from later template edits")
    void decoupledFromTemplate() {
        final FormTemplate template = template(UUID.randomUUID(), RECRUITER, true);
        final FormSnapshot snapshot = FormSnapshot.of(template);

        template.setName("Renamed");
        template.getFields().get(0).setLabel("Changed label");
        template.getFields().clear();

        assertThat(snapshot.formName()).isEqualTo("Screening");
        assertThat(snapshot.fields()).hasSize(1);
        assertThat(snapshot.field(NAME_FIELD)).get()
                .extracting(FormSnapshot.SnapshotField::label)
                .isEqualTo("Your name");
    }
}

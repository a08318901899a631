package org.smap.xlsconvert.managers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smap.xlsconvert.managers.TestForms.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Table;

class RedundantColumnManagerTest {

	private RedundantColumnManager manager = new RedundantColumnManager(LOCALISATION);

	@Test
	@DisplayName("empty columns and unused columns are removed")
	void prune() {
		Table survey = table("survey", cols("type", "name", "hint", "style", "readonly", "appearance"),
				row("text", "a", null, "pages", "yes", "NaN"),
				row("note", "b", "", null, null, null));

		Table out = manager.prune(survey, warnings());

		assertThat(out.getColumns()).containsExactly("type", "name");
		assertThat(out.getRow(0).get("style")).isNull();
	}

	@Test
	@DisplayName("the settings sheet is not pruned")
	void settingsKept() {
		Table survey = table("survey", cols("type"), row("text"));
		Table settings = table("settings", cols("form_title", "style"), row("T", null));

		PipelineState out = manager.apply(new PipelineState(survey, null, settings, "f"), warnings());

		assertThat(out.getSettings()).isSameAs(settings);
		assertThat(out.getChoices()).isNull();
	}

	@Test
	@DisplayName("running again makes no changes")
	void idempotent() {
		Table choices = table("choices", cols("list_name", "name", "label", "autoplay", "image"),
				row("yn", "yes", "Yes", "audio"),
				row("yn", "no", "No"));

		Table once = manager.prune(choices, warnings());

		assertThat(once.getColumns()).containsExactly("list_name", "name", "label");
		assertThat(manager.prune(once, warnings())).isEqualTo(once);
	}
}

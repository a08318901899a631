package org.smap.xlsconvert.managers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smap.xlsconvert.managers.TestForms.*;

import java.util.ArrayList;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

class LanguageColumnManagerTest {

	private LanguageColumnManager manager = new LanguageColumnManager(LOCALISATION);

	@Test
	@DisplayName("language variants are merged into the canonical columns and dropped")
	void mergeVariants() {
		Table survey = table("survey",
				cols("type", "name", "label:English", "label::Arabic (ar)", "hint:العربية"),
				row("text", "q1", "Name", "الاسم", "تلميح"));

		Table out = manager.normalize(survey, warnings());

		assertThat(out.getColumns()).containsExactly("type", "name",
				"label::English", "label::Arabic", "hint::English", "hint::Arabic");
		Row r = out.getRow(0);
		assertThat(r.get("label::English")).isEqualTo("Name");
		assertThat(r.get("label::Arabic")).isEqualTo("الاسم");
		assertThat(r.get("hint::Arabic")).isEqualTo("تلميح");
		assertThat(r.isBlank("hint::English")).isTrue();
	}

	@Test
	@DisplayName("the first alias in column order wins and plain label is kept")
	void firstMatchWins() {
		Table survey = table("survey",
				cols("name", "label::English (en)", "label"),
				row("q1", "From tagged", "From plain"),
				row("q2", null, "Only plain"));

		Table out = manager.normalize(survey, warnings());

		assertThat(out.getValues("label::English")).containsExactly("From tagged", "Only plain");
		assertThat(out.hasColumn("label")).isTrue();
		assertThat(out.hasColumn("label::English (en)")).isFalse();
	}

	@Test
	@DisplayName("existing canonical values are never overwritten")
	void keepCanonical() {
		Table survey = table("survey",
				cols("name", "label", "label::English"),
				row("q1", "Plain", "Canonical"));

		Table out = manager.normalize(survey, warnings());

		assertThat(out.getRow(0).get("label::English")).isEqualTo("Canonical");
	}

	@Test
	@DisplayName("aliases are matched exactly")
	void exactMatchOnly() {
		Table survey = table("survey",
				cols("name", "Label::english"),
				row("q1", "Not an alias"));

		Table out = manager.normalize(survey, warnings());

		assertThat(out.hasColumn("Label::english")).isTrue();
		assertThat(out.getRow(0).isBlank("label::English")).isTrue();
	}

	@Test
	@DisplayName("merges and dropped columns are reported")
	void reportsChanges() {
		Table survey = table("survey",
				cols("name", "label:English"),
				row("q1", "A"),
				row("q2", "B"));
		ArrayList<ApplicationWarning> warnings = warnings();

		manager.normalize(survey, warnings);

		assertThat(messages(warnings)).containsExactly(
				"2 values from column label:English were copied into label::English in the survey worksheet",
				"Language column label:English was removed from the survey worksheet");
	}

	@Test
	@DisplayName("survey and choices are both normalized and the input is not changed")
	void applyToBothSheets() {
		Table survey = table("survey", cols("name", "label"), row("q1", "Question"));
		Table choices = table("choices", cols("list_name", "name", "label:العربية"), row("yn", "yes", "نعم"));

		PipelineState out = manager.apply(new PipelineState(survey, choices, null, "f"), warnings());

		assertThat(out.getChoices().getRow(0).get("label::Arabic")).isEqualTo("نعم");
		assertThat(out.getSurvey().getRow(0).get("label::English")).isEqualTo("Question");
		assertThat(choices.hasColumn("label:العربية")).isTrue();
	}

	@Test
	@DisplayName("running again makes no changes")
	void idempotent() {
		Table survey = table("survey",
				cols("type", "name", "label", "label:English", "hint::Arabic (ar)"),
				row("text", "q1", "A", "B", "C"),
				row("note", "q2", null, "D", null));

		Table once = manager.normalize(survey, warnings());
		ArrayList<ApplicationWarning> warnings = warnings();
		Table twice = manager.normalize(once, warnings);

		assertThat(twice).isEqualTo(once);
		assertThat(warnings).isEmpty();
	}
}

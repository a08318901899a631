package org.smap.xlsconvert.managers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.smap.xlsconvert.managers.TestForms.*;

import java.util.ArrayList;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

class CoreSheetManagerTest {

	private CoreSheetManager manager = new CoreSheetManager(LOCALISATION, new ConvertSettings());

	@Test
	@DisplayName("a form without a survey cannot be converted")
	void missingSurvey() {
		PipelineState state = new PipelineState(null, null, null, "form");

		assertThatThrownBy(() -> manager.apply(state, warnings()))
				.isInstanceOf(ApplicationException.class)
				.hasMessageContaining("survey worksheet is missing");
	}

	@Test
	@DisplayName("missing choices and settings are created")
	void synthesizeSheets() throws ApplicationException {
		Table survey = table("survey", cols("type", "name"), row("text", "q1"));
		ArrayList<ApplicationWarning> warnings = warnings();

		PipelineState out = manager.apply(new PipelineState(survey, null, null, "Household Survey"), warnings);

		assertThat(out.getChoices().getColumns()).containsExactly("list_name", "name", "label");
		assertThat(out.getChoices().size()).isZero();

		Row settings = out.getSettings().getRow(0);
		assertThat(settings.get("form_title")).isEqualTo("Household Survey");
		assertThat(settings.get("form_id")).isEqualTo("household_survey");
		assertThat(settings.get("default_language")).isEqualTo("English");
		assertThat(warnings).hasSize(2);
	}

	@Test
	@DisplayName("rows with no values are removed")
	void emptyRows() throws ApplicationException {
		Table survey = table("survey", cols("type", "name"),
				row("text", "q1"),
				row(null, null),
				row("NaN", ""),
				row("integer", "q2"));
		ArrayList<ApplicationWarning> warnings = warnings();

		PipelineState out = manager.apply(new PipelineState(survey, new Table("choices"), new Table("settings"), "f"), warnings);

		assertThat(out.getSurvey().getValues("name")).containsExactly("q1", "q2");
		assertThat(survey.size()).isEqualTo(4);
		assertThat(messages(warnings)).containsExactly("2 empty rows were removed from the survey worksheet");
	}
}

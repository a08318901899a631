package org.smap.xlsconvert.managers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smap.xlsconvert.managers.TestForms.*;

import java.util.ArrayList;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.model.Table;

class DefaultValueManagerTest {

	private DefaultValueManager manager = new DefaultValueManager(LOCALISATION);

	@Test
	@DisplayName("defaults that look up data or refer to questions are removed")
	void removeInvalid() {
		Table survey = table("survey", cols("type", "name", "default"),
				row("text", "a", "pulldata('x','y','z','w')"),
				row("integer", "b", "${a}"),
				row("integer", "c", "5"),
				row("text", "d"));
		ArrayList<ApplicationWarning> warnings = warnings();

		Table out = manager.removeInvalidDefaults(survey, warnings);

		assertThat(out.getValues("default")).containsExactly(null, null, "5", null);
		assertThat(warnings).hasSize(2);
		assertThat(survey.getRow(1).getDefault()).isEqualTo("${a}");
	}

	@Test
	@DisplayName("a survey without a default column is unchanged")
	void noDefaultColumn() {
		Table survey = table("survey", cols("type", "name"), row("text", "a"));

		assertThat(manager.removeInvalidDefaults(survey, warnings())).isEqualTo(survey);
	}

	@Test
	@DisplayName("running again makes no changes")
	void idempotent() {
		Table survey = table("survey", cols("default"), row("${x}"), row("today"));

		Table once = manager.removeInvalidDefaults(survey, warnings());
		ArrayList<ApplicationWarning> warnings = warnings();

		assertThat(manager.removeInvalidDefaults(once, warnings)).isEqualTo(once);
		assertThat(warnings).isEmpty();
	}
}

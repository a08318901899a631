package org.smap.xlsconvert.managers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.smap.xlsconvert.managers.TestForms.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.constants.KoboQuestionTypes;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

class ConversionManagerTest {

	private ArrayList<ApplicationWarning> warnings;
	private ConversionManager manager;

	@BeforeEach
	void setUp() throws ApplicationException {
		warnings = warnings();
		manager = new ConversionManager(LOCALISATION, warnings, new ConvertSettings());
	}

	private Table surveyCtoForm() {
		return table("survey",
				cols("type", "name", "label:English", "label::Arabic (ar)", "hint", "calculation", "relevant",
						"default", "style", "notes"),
				row("begin group", "Household", "Household"),
				row("deviceid", "device"),
				row("text", "Head Name", "Name of head", "اسم الرب", "Full name"),
				row("integer", "Age", "Age"),
				row("integer", "Age", "Age again", null, null, null, null, "${age}"),
				row("select_one sGovernorateList", "gov", "Governorate"),
				row("select_one sDistrictList", "dist", "District"),
				row("calculate", "calc", null, null, null, "pulldata('hh','x','y',${gov})"),
				row("begin repeat", "members", "Members"),
				row("text", "member name", "Member", null, null, null, "${Age} > 1"),
				row("rank", "rank_q", "Rank", null, null, null, null, null, "pages"),
				row(null, null));
	}

	@Test
	@DisplayName("the steps run in a fixed order")
	void stepNames() {
		assertThat(manager.getStepNames()).containsExactly(
				"Load Core Sheets",
				"Normalize Language Columns",
				"Fix Field Types",
				"Apply Label Fallbacks",
				"Clean Calculation Fields",
				"Remove Invalid Defaults",
				"Normalize Field Names",
				"Validate Group & Repeat Logic",
				"Fix Cascading Selects",
				"Check Settings Sheet",
				"Remove Redundant Columns");
	}

	@Test
	@DisplayName("a SurveyCTO form is converted to a valid Kobo form")
	void convertForm() throws ApplicationException {
		Table input = surveyCtoForm();
		Table inputCopy = input.copy();

		PipelineState out = manager.runPipeline(input, null, null, "Household Survey");
		Table survey = out.getSurvey();

		// Types
		for(Row r : survey.getRows()) {
			assertThat(r.getType() == null || KoboQuestionTypes.isStandardType(r.getType())).isTrue();
		}
		assertThat(survey.getValues("type")).contains("select_one governorate", "select_one district");

		// Labels
		for(Row r : survey.getRows()) {
			if(!r.isBlank(XLSFormColumns.NAME)) {
				for(String col : XLSFormColumns.CANONICAL_LANGUAGE_COLUMNS) {
					assertThat(r.isBlank(col)).isFalse();
				}
			}
		}

		// Names
		ArrayList<String> names = new ArrayList<> ();
		for(Row r : survey.getRows()) {
			if(!r.isBlank(XLSFormColumns.NAME)) {
				names.add(r.getName());
			}
		}
		assertThat(names).allMatch(n -> n.matches("[a-z0-9_]+"));
		assertThat(new HashSet<> (names)).hasSameSizeAs(names);
		assertThat(names).contains("head_name", "age", "age_1", "member_name");

		// Groups
		List<String> types = survey.getValues("type");
		assertThat(types.subList(types.size() - 2, types.size())).containsExactly("end repeat", "end group");

		// Columns
		assertThat(survey.hasColumn("style")).isFalse();
		assertThat(survey.hasColumn("notes")).isFalse();
		assertThat(survey.hasColumn("label:English")).isFalse();
		assertThat(survey.hasColumn("default")).isFalse();

		// Choices and settings
		assertThat(out.getChoices().size()).isEqualTo(9);
		assertThat(out.getSettings().getRow(0).get("form_id")).isEqualTo("household_survey");

		assertThat(input).isEqualTo(inputCopy);
		assertThat(warnings).isNotEmpty();
		assertThat(warnings).allMatch(w -> manager.getStepNames().contains(w.step));
	}

	@Test
	@DisplayName("the expression row is turned into text with no calculation")
	void expressionRow() throws ApplicationException {
		PipelineState out = manager.runPipeline(surveyCtoForm(), null, null, "f");

		Row calc = null;
		for(Row r : out.getSurvey().getRows()) {
			if("calc".equals(r.getName())) {
				calc = r;
			}
		}
		assertThat(calc).isNotNull();
		assertThat(calc.getType()).isEqualTo("text");
		assertThat(calc.getCalculation()).isNull();
	}

	@Test
	@DisplayName("a form without a survey is rejected before any step runs")
	void missingSurvey() {
		assertThatThrownBy(() -> manager.runPipeline(null, new Table("choices"), null, "f"))
				.isInstanceOf(ApplicationException.class);
		assertThat(warnings).isEmpty();
	}

	@Test
	@DisplayName("a single step can be run again on a saved state")
	void runStep() throws ApplicationException {
		PipelineState out = manager.runPipeline(surveyCtoForm(), null, null, "f");

		int idx = manager.getStepNames().indexOf("Fix Field Types");
		PipelineState again = manager.runStep(idx, out);

		assertThat(again.getSurvey()).isEqualTo(out.getSurvey());
		assertThat(again).isNotSameAs(out);
	}

	@Test
	@DisplayName("running the whole pipeline again gives the same form")
	void rerunPipeline() throws ApplicationException {
		PipelineState once = manager.runPipeline(surveyCtoForm(), null, null, "f");
		PipelineState twice = manager.runPipeline(once.getSurvey(), once.getChoices(), once.getSettings(), "f");

		assertThat(twice.getSurvey()).isEqualTo(once.getSurvey());
		assertThat(twice.getChoices()).isEqualTo(once.getChoices());
		assertThat(twice.getSettings()).isEqualTo(once.getSettings());
	}
}

package org.smap.xlsconvert.model;

/*
 * The three worksheets of a form as they pass from one conversion step to the next
 * A step returns a new state rather than modifying the one it was given
 */
public class PipelineState {

	private final Table survey;
	private final Table choices;
	private final Table settings;
	private final String formName;

	public PipelineState(Table survey, Table choices, Table settings, String formName) {
		this.survey = survey;
		this.choices = choices;
		this.settings = settings;
		this.formName = formName;
	}

	public Table getSurvey() {
		return survey;
	}

	public Table getChoices() {
		return choices;
	}

	public Table getSettings() {
		return settings;
	}

	public String getFormName() {
		return formName;
	}

	public PipelineState withSurvey(Table t) {
		return new PipelineState(t, choices, settings, formName);
	}

	public PipelineState withChoices(Table t) {
		return new PipelineState(survey, t, settings, formName);
	}

	public PipelineState withSettings(Table t) {
		return new PipelineState(survey, choices, t, formName);
	}
}

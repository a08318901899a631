package org.smap.xlsconvert.model;

import java.util.ArrayList;

import org.smap.xlsconvert.Utilities.ApplicationWarning;

/*
 * Summary of a conversion, written out as JSON by the batch converter
 */
public class ConversionReport {
	public String formName;
	public String inputFile;
	public String outputFile;
	public ArrayList<String> steps = new ArrayList<> ();
	public int surveyRows;
	public int choiceRows;
	public ArrayList<ApplicationWarning> warnings = new ArrayList<> ();

	public ConversionReport(String formName) {
		this.formName = formName;
	}

	public void setResult(PipelineState state) {
		surveyRows = state.getSurvey().size();
		choiceRows = state.getChoices() == null ? 0 : state.getChoices().size();
	}
}

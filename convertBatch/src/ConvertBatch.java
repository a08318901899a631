import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.ResourceBundle;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.Utilities.GeneralUtilityMethods;
import org.smap.xlsconvert.managers.ConversionManager;
import org.smap.xlsconvert.managers.XLSFormManager;
import org.smap.xlsconvert.managers.XLSFormUploadManager;
import org.smap.xlsconvert.model.ConversionReport;
import org.smap.xlsconvert.model.PipelineState;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/*
 * Convert a single SurveyCTO workbook and write the Kobo workbook and a report of the changes
 */
public class ConvertBatch {

	private static Logger log =
			 Logger.getLogger(ConvertBatch.class.getName());

	public ConversionReport go(String inputFile, String outputDir, String formName) throws ApplicationException, IOException {

		ResourceBundle localisation = GeneralUtilityMethods.getLocalisation();
		ConvertSettings settings = new ConvertSettings();

		File input = new File(inputFile);
		File dir = outputDir == null ? input.getAbsoluteFile().getParentFile() : new File(outputDir);
		FileUtils.forceMkdir(dir);

		if(formName == null) {
			formName = XLSFormUploadManager.getFormName(input.getName());
		}
		log.info("Converting " + inputFile + " as form " + formName);

		XLSFormUploadManager xfum = new XLSFormUploadManager(localisation);
		PipelineState state = null;
		try (InputStream is = new FileInputStream(input)) {
			state = xfum.getForm(is, input.getName(), formName);
		}

		ArrayList<ApplicationWarning> warnings = new ArrayList<> ();
		ConversionManager cm = new ConversionManager(localisation, warnings, settings);
		PipelineState result = cm.runPipeline(state.getSurvey(), state.getChoices(), state.getSettings(), formName);

		String type = settings.getOutputType();
		File outputFile = new File(dir, formName + "_kobo." + type);
		XLSFormManager xfm = new XLSFormManager(type);
		try (OutputStream os = new FileOutputStream(outputFile)) {
			xfm.createXLSForm(os, result);
		}

		ConversionReport report = new ConversionReport(formName);
		report.inputFile = input.getPath();
		report.outputFile = outputFile.getPath();
		report.steps = cm.getStepNames();
		report.warnings = warnings;
		report.setResult(result);

		Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
		File reportFile = new File(dir, formName + "_report.json");
		FileUtils.writeStringToFile(reportFile, gson.toJson(report), StandardCharsets.UTF_8);

		return report;
	}
}

import java.util.logging.Level;
import java.util.logging.Logger;

import org.smap.xlsconvert.model.ConversionReport;

/*****************************************************************************

This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

 ******************************************************************************/

/*
 * Usage java -jar convertBatch.jar {surveycto xls file} {output directory} {form name}
 */

public class Manager {

	private static Logger log =
			 Logger.getLogger(Manager.class.getName());

	public static void main(String[] args) {

		String inputFile = null;
		String outputDir = null;		// Default is the directory of the input file
		String formName = null;			// Default is the input file name

		if(args.length > 0) {
			inputFile = args[0];
			if(args.length > 1) {
				if(args[1] != null && !args[1].equals("null")) {
					outputDir = args[1];
				}
			}
			if(args.length > 2) {
				formName = args[2];
			}
		} else {
			System.out.println("Usage: java -jar convertBatch.jar {surveycto xls file} [output directory] [form name]");
			System.exit(1);
		}

		try {
			ConvertBatch batch = new ConvertBatch();
			ConversionReport report = batch.go(inputFile, outputDir, formName);
			log.info("Converted " + report.inputFile + " to " + report.outputFile
					+ " with " + report.warnings.size() + " warnings");
		} catch (Exception e) {
			log.log(Level.SEVERE, "Conversion failed: " + e.getMessage(), e);
			System.exit(1);
		}
	}
}

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

package org.smap.xlsconvert.Utilities;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

public class GeneralUtilityMethods {

	private static Logger log = Logger.getLogger(GeneralUtilityMethods.class.getName());

	public static final String NAN_MARKER = "NaN";		// Written by the XLS reader for a numeric cell that is not a number
	private static final String UTF8_BOM = "\uFEFF";
	private static final String RESOURCES = "org.smap.xlsconvert.resources.ConvertResources";

	private GeneralUtilityMethods() {
	}

	/*
	 * The single test for "no value" used by every conversion step
	 */
	public static boolean isBlank(String value) {
		return value == null || value.isEmpty() || value.equals(NAN_MARKER);
	}

	/*
	 * Normalise a name to lower case, underscores for spaces and only a-z, 0-9 and _
	 * Blank input gives an empty string
	 */
	public static String normalizeName(String in) {

		if(isBlank(in)) {
			return "";
		}

		String out = in.toLowerCase(Locale.ROOT);
		out = out.replace(" ", "_");
		out = out.replaceAll("[^a-z0-9_]", "");

		return out;
	}

	public static String removeBOM(String in) {

		if (in != null && in.startsWith(UTF8_BOM)) {
			in = in.substring(1);
		}
		return in;
	}

	/*
	 * Spreadsheet row number of a table row, the heading is row 1
	 */
	public static int getSheetRow(int rowIndex) {
		return rowIndex + 2;
	}

	/*
	 * Get the localised messages
	 */
	public static ResourceBundle getLocalisation(Locale locale) {
		ResourceBundle localisation;
		try {
			localisation = ResourceBundle.getBundle(RESOURCES, locale);
		} catch(MissingResourceException e) {
			log.log(Level.SEVERE, "Localisation for " + locale + " not found, using the default", e);
			localisation = ResourceBundle.getBundle(RESOURCES, Locale.ROOT);
		}
		return localisation;
	}

	public static ResourceBundle getLocalisation() {
		return getLocalisation(new Locale("en"));
	}
}

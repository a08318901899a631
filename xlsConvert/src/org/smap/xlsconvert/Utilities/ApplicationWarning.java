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

/*
 * A correction that was applied to the form without stopping the conversion
 */
public class ApplicationWarning {

	public String step;			// Name of the step that raised the warning
	public String message;

	public ApplicationWarning(String message) {
		this.message = message;
	}

	public ApplicationWarning(String step, String message) {
		this.step = step;
		this.message = message;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return step == null ? message : step + ": " + message;
	}
}

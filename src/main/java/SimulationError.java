/**
 **
 ** SimulationError.java - fatal problem found while validating simulation inputs
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SimulationError.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

/**
 * Fatal configuration or input data problem. Validation collects these instead of
 * throwing, the simulation aborts if any were found.
 */
public class SimulationError {
	public enum Kind {
		INVALID_PARAMETER,
		SAMPLING_NOT_INTEGER,
		GAMMA_NOT_INTEGER,
		SAMPLING_NOT_POWER_OF_TWO,
		EVEN_NUMBER_OF_SLICES,
		WFE_SAMPLING_MISMATCH,
		WFE_NOT_FOUND,
		WFE_MISSING_WAVELENGTHS,
		WFE_INCOMPLETE_SET,
		WFE_INSUFFICIENT_FIELDS,
		WFE_READ_ERROR
	}

	private final Kind   kind;
	private final String message;

	public SimulationError(Kind kind, String message){
		this.kind=kind;
		this.message=message;
	}

	public Kind getKind() {
		return this.kind;
	}
	public String getMessage() {
		return this.message;
	}

	@Override
	public String toString(){
		return this.kind+": "+this.message;
	}
}

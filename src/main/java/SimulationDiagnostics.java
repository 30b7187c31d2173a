/**
 **
 ** SimulationDiagnostics.java - diagnostics sink used by the sliced PSF simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SimulationDiagnostics.java is free software: you can redistribute it and/or modify
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
 * Receives progress and problem reports from the simulation components.
 * Passed explicitly to every component that reports anything.
 */
public interface SimulationDiagnostics {
	void debug(String message);
	void info(String message);
	/** non-fatal problem, the simulation proceeds */
	void warning(String message);
	/** fatal problem, reported right before the run is aborted */
	void critical(String message);
	int getDebugLevel();
}

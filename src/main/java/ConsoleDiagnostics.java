/**
 **
 ** ConsoleDiagnostics.java - console output of the simulation diagnostics
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ConsoleDiagnostics.java is free software: you can redistribute it and/or modify
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

import java.io.PrintStream;

/**
 * Prints diagnostics as LEVEL:message lines. Critical messages are always printed,
 * warnings and info need debugLevel>0, debug messages need debugLevel>1.
 */
public class ConsoleDiagnostics implements SimulationDiagnostics {
	public int debugLevel=1;
	private final PrintStream out;
	private final PrintStream err;

	public ConsoleDiagnostics(int debugLevel){
		this(debugLevel, System.out, System.err);
	}
	public ConsoleDiagnostics(int debugLevel, PrintStream out, PrintStream err){
		this.debugLevel=debugLevel;
		this.out=out;
		this.err=err;
	}

	public void debug(String message) {
		if (this.debugLevel>1) this.out.println("DEBUG:"+message);
	}
	public void info(String message) {
		if (this.debugLevel>0) this.out.println("INFO:"+message);
	}
	public void warning(String message) {
		if (this.debugLevel>0) this.err.println("WARNING:"+message);
	}
	public void critical(String message) {
		this.err.println("CRITICAL:"+message);
	}
	public int getDebugLevel() {
		return this.debugLevel;
	}
}

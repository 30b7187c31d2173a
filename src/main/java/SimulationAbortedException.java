/**
 **
 ** SimulationAbortedException.java - thrown when validation found fatal errors
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SimulationAbortedException.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SimulationAbortedException extends RuntimeException {
	private static final long serialVersionUID = 4829371940286518374L;
	private final List<SimulationError> errors;

	public SimulationAbortedException(List<SimulationError> errors){
		super(buildMessage(errors));
		this.errors=Collections.unmodifiableList(new ArrayList<SimulationError>(errors));
	}

	public SimulationAbortedException(SimulationError error){
		this(Collections.singletonList(error));
	}

	public List<SimulationError> getErrors(){
		return this.errors;
	}

	private static String buildMessage(List<SimulationError> errors){
		if (errors.isEmpty()) return "Simulation aborted";
		StringBuilder sb=new StringBuilder("Simulation aborted: ");
		for (int i=0;i<errors.size();i++){
			if (i>0) sb.append("; ");
			sb.append(errors.get(i).getMessage());
		}
		return sb.toString();
	}
}

/**
 **
 ** WfeFileSorter.java - finds and checks the Zemax WFE files for a simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WfeFileSorter.java is free software: you can redistribute it and/or modify
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

import java.io.File;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scans a directory for Zemax wavefront maps that match the simulated wavelengths and checks
 * that they form a complete set (same number of files for each wavelength and each field, at
 * least as many fields as slices).
 */
public class WfeFileSorter {
	private final SimulationDiagnostics diagnostics;

	public static class Result {
		private final WfeCatalogue catalogue;
		private final List<SimulationError> errors;
		Result(WfeCatalogue catalogue, List<SimulationError> errors){
			this.catalogue=catalogue;
			this.errors=Collections.unmodifiableList(errors);
		}
		public boolean isValid(){
			return this.errors.isEmpty();
		}
		/** null when there are errors */
		public WfeCatalogue getCatalogue(){
			return this.catalogue;
		}
		public List<SimulationError> getErrors(){
			return this.errors;
		}
	}

	public WfeFileSorter(SimulationDiagnostics diagnostics){
		this.diagnostics=diagnostics;
	}

	/**
	 * @param dir directory with WFE listings
	 * @param prefix file name prefix, files that do not start with it are ignored
	 * @param waves simulated wavelengths, m
	 * @param nFields minimal number of distinct fields (number of slices)
	 */
	public Result sort(File dir, String prefix, List<BigDecimal> waves, int nFields){
		debug(" Searching directory "+dir+" for WFE maps...");
		List<WfeCatalogue.Entry> entries=new ArrayList<WfeCatalogue.Entry>();
		File [] files=dir.listFiles();
		if (files==null) {
			List<SimulationError> errors=new ArrayList<SimulationError>();
			errors.add(new SimulationError(SimulationError.Kind.WFE_NOT_FOUND, "WFE directory "+dir+" does not exist or can not be read"));
			return new Result(null, errors);
		}
		Arrays.sort(files);
		if (prefix==null) prefix="";
		for (File file:files){
			String name=file.getName();
			if (!file.isFile() || name.endsWith("~") || !name.startsWith(prefix)) continue;
			debug(" Attempting to parse file "+name);
			ZemaxWfeFile wfe=new ZemaxWfeFile(file, this.diagnostics);
			if (!wfe.parseFileHeader()){
				debug(" - This is not a valid WFE map, ignoring");
				continue;
			}
			ZemaxWfeFile.Header header=wfe.getHeader();
			BigDecimal wavelength=header.getWavelength();
			debug(" - Wavelength: "+wavelength.movePointRight(9).round(new MathContext(3)).toPlainString()+"nm");
			BigDecimal match=findWavelength(waves, wavelength);
			if (match==null){
				debug(" - Wavelength not found in requested list, ignoring");
				continue;
			}
			debug(" - Field: "+header.field[0]+", "+header.field[1]);
			entries.add(new WfeCatalogue.Entry(file, match, header.field));
		}
		return check(entries, waves, nFields);
	}

	/**
	 * Checks an explicit list of WFE files (read from the configuration) the same way as a
	 * directory scan.
	 */
	public Result check(List<WfeCatalogue.Entry> entries, List<BigDecimal> waves, int nFields){
		List<SimulationError> errors=new ArrayList<SimulationError>();
		if (entries.isEmpty()){
			errors.add(new SimulationError(SimulationError.Kind.WFE_NOT_FOUND, "No WFE maps found"));
			return report(new Result(null, errors));
		}
		Map<BigDecimal,Integer> perWave=new TreeMap<BigDecimal,Integer>();
		Map<String,Integer> perField=new HashMap<String,Integer>();
		for (WfeCatalogue.Entry entry:entries){
			Integer n=perWave.get(entry.wavelength);
			perWave.put(entry.wavelength, (n==null)?1:(n+1));
			n=perField.get(entry.getFieldKey());
			perField.put(entry.getFieldKey(), (n==null)?1:(n+1));
		}
		List<BigDecimal> missing=new ArrayList<BigDecimal>();
		for (BigDecimal w:waves) if (!perWave.containsKey(w)) missing.add(w);
		if (!missing.isEmpty()){
			StringBuilder sb=new StringBuilder("WFE maps are not present for all wavelengths, missing:");
			for (BigDecimal w:missing) sb.append(" ").append(w.toPlainString());
			errors.add(new SimulationError(SimulationError.Kind.WFE_MISSING_WAVELENGTHS, sb.toString()));
		}
		if (new HashSet<Integer>(perWave.values()).size()>1){
			errors.add(new SimulationError(SimulationError.Kind.WFE_INCOMPLETE_SET,
					"The WFE maps form an incomplete set, files per wavelength: "+perWave));
		}
		if (new HashSet<Integer>(perField.values()).size()>1){
			errors.add(new SimulationError(SimulationError.Kind.WFE_INCOMPLETE_SET,
					"The WFE maps form an incomplete set, files per field: "+perField));
		}
		if (perField.size()<nFields){
			errors.add(new SimulationError(SimulationError.Kind.WFE_INSUFFICIENT_FIELDS,
					"Insufficient fields for number of slices ("+perField.size()+" < "+nFields+")"));
		}
		if (!errors.isEmpty()) return report(new Result(null, errors));
		debug(" Found "+entries.size()+" WFE maps for "+perWave.size()+" wavelengths and "+perField.size()+" fields");
		return new Result(new WfeCatalogue(entries, perField.size(), this.diagnostics), errors);
	}

	static BigDecimal findWavelength(List<BigDecimal> waves, BigDecimal wavelength){
		for (BigDecimal w:waves) if (w.compareTo(wavelength)==0) return w;
		return null;
	}

	private Result report(Result result){
		if (this.diagnostics!=null) for (SimulationError e:result.getErrors()) this.diagnostics.critical(" "+e.getMessage());
		return result;
	}

	private void debug(String msg){
		if (this.diagnostics!=null) this.diagnostics.debug(msg);
	}

}

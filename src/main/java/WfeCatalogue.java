/**
 **
 ** WfeCatalogue.java - wavefront error files available for the simulated wavelengths
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WfeCatalogue.java is free software: you can redistribute it and/or modify
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
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validated set of WFE files, grouped by wavelength and ordered by field (x, then y).
 * Read-only after construction, shared by all simulation threads.
 */
public class WfeCatalogue {
	public static class Entry {
		public final File       path;
		public final BigDecimal wavelength; // requested wavelength the file matched, m
		public final double []  field;
		public Entry(File path, BigDecimal wavelength, double [] field){
			this.path=path;
			this.wavelength=wavelength;
			this.field=field.clone();
		}
		public String getFieldKey(){
			return this.field[0]+","+this.field[1];
		}
		@Override
		public String toString(){
			return this.path+" ("+this.wavelength.toPlainString()+" m, field "+getFieldKey()+")";
		}
	}

	static final Comparator<Entry> FIELD_ORDER=new Comparator<Entry>() {
		@Override
		public int compare(Entry e1, Entry e2) {
			int c=Double.compare(e1.field[0], e2.field[0]);
			return (c!=0)?c:Double.compare(e1.field[1], e2.field[1]);
		}
	};

	private final Map<BigDecimal,List<Entry>> byWavelength=new TreeMap<BigDecimal,List<Entry>>(); // compareTo keys, 0.80E-6 == 8E-7
	private final int numberOfFields;
	private final SimulationDiagnostics diagnostics;

	WfeCatalogue(List<Entry> entries, int numberOfFields, SimulationDiagnostics diagnostics){
		for (Entry entry:entries){
			List<Entry> list=this.byWavelength.get(entry.wavelength);
			if (list==null){
				list=new ArrayList<Entry>();
				this.byWavelength.put(entry.wavelength, list);
			}
			list.add(entry);
		}
		for (List<Entry> list:this.byWavelength.values()) Collections.sort(list, FIELD_ORDER);
		this.numberOfFields=numberOfFields;
		this.diagnostics=diagnostics;
	}

	public int getNumberOfFields(){
		return this.numberOfFields;
	}

	public List<Entry> getEntries(BigDecimal wavelength){
		List<Entry> list=this.byWavelength.get(wavelength);
		return (list==null)?Collections.<Entry>emptyList():Collections.unmodifiableList(list);
	}

	/**
	 * Selects the WFE file for a slice: slice k (1-based) uses the k-th field when there are at
	 * least as many fields as slices, otherwise every slice uses the first field.
	 * @param wavelength simulated wavelength (exact match)
	 * @param sliceNumber slice number, 1..nSlices
	 * @param nSlices number of slices
	 */
	public Entry select(BigDecimal wavelength, int sliceNumber, int nSlices){
		List<Entry> list=this.byWavelength.get(wavelength);
		if ((list==null) || list.isEmpty()) {
			throw new IllegalArgumentException("No WFE map for wavelength "+wavelength.toPlainString()+" m");
		}
		int index=(list.size()>=nSlices)?(sliceNumber-1):0;
		if ((index<0) || (index>=list.size())) {
			throw new IllegalArgumentException("Slice number "+sliceNumber+" is outside of 1.."+nSlices);
		}
		return list.get(index);
	}

	/** reads the map selected for the slice */
	public WfeMap load(BigDecimal wavelength, int sliceNumber, int nSlices) throws IOException {
		Entry entry=select(wavelength, sliceNumber, nSlices);
		return new ZemaxWfeFile(entry.path, this.diagnostics).parse();
	}
}

/**
 **
 ** SimulationPreflight.java - checks simulation parameters and WFE data before any transform
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SimulationPreflight.java is free software: you can redistribute it and/or modify
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validates the simulation inputs. Fatal problems are returned as {@link SimulationError}
 * values, problems that only may affect the result are reported as warnings.
 */
public class SimulationPreflight {
	private final SimulationDiagnostics diagnostics;

	public SimulationPreflight(SimulationDiagnostics diagnostics){
		this.diagnostics=diagnostics;
	}

	/**
	 * Checks the numeric parameters
	 * @return fatal errors, empty if the simulation can run
	 */
	public List<SimulationError> validate(SlicedPsfParameters parameters){
		List<SimulationError> errors=new ArrayList<SimulationError>();
		Integer sampling=parameters.pupil.getSampling();
		Integer gamma=parameters.pupil.getGamma();
		if ((sampling==null) || (gamma==null)){
			errors.add(new SimulationError((sampling==null)?SimulationError.Kind.SAMPLING_NOT_INTEGER:SimulationError.Kind.GAMMA_NOT_INTEGER,
					"PUPIL_SAMPLING and PUPIL_GAMMA should be an integer! (sampling="+parameters.pupil.sampling+", gamma="+parameters.pupil.gamma+")"));
		}
		if ((gamma!=null) && (gamma<1)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Pupil gamma should be positive, got "+gamma));
		} else if ((gamma!=null) && ((gamma%2)!=0)) {
			warning(" Pupil gamma should be even. Could produce unexpected results.");
		}
		if ((parameters.general.nSlices%2)!=1) {
			errors.add(new SimulationError(SimulationError.Kind.EVEN_NUMBER_OF_SLICES,
					"Number of slices should be odd! (got "+parameters.general.nSlices+")"));
		}
		if ((sampling!=null) && (sampling<2)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER,
					"Pupil sampling should be at least 2! (got "+sampling+")"));
		} else if ((sampling!=null) && !ComplexFHT.isPowerOfTwo(sampling)) {
			errors.add(new SimulationError(SimulationError.Kind.SAMPLING_NOT_POWER_OF_TWO,
					"Pupil sampling should be a power of two! (got "+sampling+")"));
		}
		if (!(parameters.slicing.width>0)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Slice width should be positive, got "+parameters.slicing.width));
		}
		if (!(parameters.general.detectorPixelPitch>0)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Detector pixel pitch should be positive, got "+parameters.general.detectorPixelPitch));
		}
		if (!(parameters.general.cameraEffl>0)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Camera focal length should be positive, got "+parameters.general.cameraEffl));
		}
		if (!(parameters.pupil.referenceWavelength>0)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Pupil reference wavelength should be positive, got "+parameters.pupil.referenceWavelength));
		}
		if (parameters.pupil.resampleTo.signum()<=0) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Resampling wavelength should be positive, got "+parameters.pupil.resampleTo));
		}
		if (!(parameters.output.resamplingFactor>0) || !(parameters.output.hfov>0)) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Output resampling factor and hfov should be positive, got "+
					parameters.output.resamplingFactor+" and "+parameters.output.hfov));
		}
		List<BigDecimal> waves=Collections.emptyList();
		if (parameters.general.wavelengthInterval.signum()<=0) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Wavelength interval should be positive, got "+
					parameters.general.wavelengthInterval));
		} else if (parameters.general.wavelengthStart.signum()<=0) {
			errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "Start wavelength should be positive, got "+
					parameters.general.wavelengthStart));
		} else {
			waves=parameters.getWavelengths();
			if (waves.isEmpty()) {
				errors.add(new SimulationError(SimulationError.Kind.INVALID_PARAMETER, "No wavelengths between "+
						parameters.general.wavelengthStart+" and "+parameters.general.wavelengthEnd));
			}
		}
		if (!waves.isEmpty() && (parameters.pupil.resampleTo.compareTo(waves.get(0))>0)) {
			warning(" Resampling wavelength ("+parameters.pupil.resampleTo.toPlainString()+" m) is longer than the shortest simulated wavelength ("+
					waves.get(0).toPlainString()+" m), the image will be extrapolated.");
		}
		for (SimulationError e:errors) critical(" "+e.getMessage());
		return errors;
	}

	/**
	 * Finds the WFE maps (explicit list from the parameters or a directory scan) and checks that
	 * their sampling matches the pupil sampling.
	 * @param parameters validated parameters
	 * @param waves simulated wavelengths
	 */
	public WfeFileSorter.Result findWfeMaps(SlicedPsfParameters parameters, List<BigDecimal> waves){
		WfeFileSorter sorter=new WfeFileSorter(this.diagnostics);
		int nSlices=parameters.general.nSlices;
		WfeFileSorter.Result result;
		if (!parameters.wfe.files.isEmpty()) {
			List<WfeCatalogue.Entry> entries=new ArrayList<WfeCatalogue.Entry>();
			for (WfeCatalogue.Entry entry:parameters.wfe.files){
				BigDecimal match=WfeFileSorter.findWavelength(waves, entry.wavelength);
				if (match!=null) entries.add(new WfeCatalogue.Entry(entry.path, match, entry.field));
			}
			result=sorter.check(entries, waves, nSlices);
		} else {
			result=sorter.sort(new File(parameters.wfe.directory), parameters.wfe.prefix, waves, nSlices);
		}
		if (!result.isValid()) return result;
		int sampling=parameters.pupil.getSampling();
		List<SimulationError> errors=new ArrayList<SimulationError>();
		for (BigDecimal wave:waves) for (WfeCatalogue.Entry entry:result.getCatalogue().getEntries(wave)){
			ZemaxWfeFile wfe=new ZemaxWfeFile(entry.path, this.diagnostics);
			if (!wfe.parseFileHeader()) {
				errors.add(new SimulationError(SimulationError.Kind.WFE_READ_ERROR, entry.path+" is not a valid Zemax WFE map"));
				continue;
			}
			SimulationError e=checkWfeSampling(wfe.getHeader().sampling, sampling);
			if (e!=null) errors.add(e);
		}
		if (errors.isEmpty()) return result;
		for (SimulationError e:errors) critical(" "+e.getMessage());
		return new WfeFileSorter.Result(null, errors);
	}

	/** null if the WFE map sampling matches the pupil sampling */
	public static SimulationError checkWfeSampling(int wfeSampling, int pupilSampling){
		if (wfeSampling==pupilSampling) return null;
		return new SimulationError(SimulationError.Kind.WFE_SAMPLING_MISMATCH,
				"Zemax WFE sampling is not the same as the pupil sampling! ("+wfeSampling+" != "+pupilSampling+")");
	}

	private void warning(String msg){
		if (this.diagnostics!=null) this.diagnostics.warning(msg);
	}

	private void critical(String msg){
		if (this.diagnostics!=null) this.diagnostics.critical(msg);
	}
}

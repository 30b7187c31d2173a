/**
 **
 ** SlicedPsfSimulation.java - simulates the PSF of an image slicer over a range of wavelengths
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SlicedPsfSimulation.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import ij.IJ;

/**
 * Runs the sliced PSF simulation.
 * <p>
 * For every wavelength the circular pupil is transformed to the image plane, resampled to the
 * plate scale of the reference wavelength and transformed back. The image of this pupil is cut
 * into slices, each slice goes back to the pupil plane (where the WFE of the slice field is
 * added), then to the image plane, and the slice images are summed coherently. The intensity
 * of the sum becomes one plane of the cube.
 */
public class SlicedPsfSimulation {
	private final SlicedPsfParameters   parameters;
	private final SimulationDiagnostics diagnostics;
	private final PsfVisualization      visualization;
	private final Resampler             resampler=new Resampler();

	private List<BigDecimal> wavelengths=null;
	private int          sampling;
	private int          gamma;
	private int          nSlices;
	private double       pupilRadius;
	private Image        referenceImage=null;
	private Slicer       slicer=null;
	private WfeCatalogue wfeCatalogue=null;

	public SlicedPsfSimulation(
			SlicedPsfParameters parameters,
			SimulationDiagnostics diagnostics,
			PsfVisualization visualization){
		this.parameters=parameters;
		this.diagnostics=(diagnostics==null)?new ConsoleDiagnostics(0):diagnostics;
		this.visualization=(visualization==null)?PsfVisualization.NONE:visualization;
	}

	/**
	 * Validates the parameters, finds WFE maps and builds the reference image all wavelengths are
	 * resampled to. Called by {@link #run()} if needed.
	 * @throws SimulationAbortedException if any fatal error was found
	 */
	public void prepare(){
		SimulationPreflight preflight=new SimulationPreflight(this.diagnostics);
		List<SimulationError> errors=preflight.validate(this.parameters);
		if (!errors.isEmpty()) throw new SimulationAbortedException(errors);
		this.wavelengths=this.parameters.getWavelengths();
		this.sampling=this.parameters.pupil.getSampling();
		this.gamma=this.parameters.pupil.getGamma();
		this.nSlices=this.parameters.general.nSlices;
		if (this.parameters.general.doWfe){
			WfeFileSorter.Result wfe=preflight.findWfeMaps(this.parameters, this.wavelengths);
			if (!wfe.isValid()) throw new SimulationAbortedException(wfe.getErrors());
			this.wfeCatalogue=wfe.getCatalogue();
		}
		this.pupilRadius=this.parameters.getPupilPhysicalRadius();
		BigDecimal resampleTo=this.parameters.pupil.resampleTo;
		this.diagnostics.debug(" Ascertaining parameters to resample to "+resampleTo.movePointRight(9).toPlainString()+"nm");
		Pupil resamplingPupil=Pupil.circular(this.sampling, this.gamma, this.pupilRadius, this.diagnostics);
		this.referenceImage=resamplingPupil.toConjugateImage(resampleTo);
		this.slicer=new Slicer(this.nSlices, this.parameters.slicing.width, this.referenceImage.getGamma());
		this.diagnostics.debug(" Reference plate scale "+IJ.d2s(this.referenceImage.getPlateScale(),6)+"\"/sample, hfov "+
				IJ.d2s(this.referenceImage.getHFOV(),4)+"\", "+this.wavelengths.size()+" wavelengths, "+this.nSlices+" slices");
	}

	/**
	 * Simulates all wavelengths
	 * @return complete cube, plate scale of the reference image
	 * @throws SimulationAbortedException on fatal errors
	 */
	public SpectralCube run(){
		final long startTime=System.nanoTime();
		this.diagnostics.debug(" Beginning simulation");
		if (this.referenceImage==null) prepare();
		final int size=this.sampling*this.gamma;
		final SpectralCube cube=new SpectralCube(this.wavelengths.size(), size, this.referenceImage.getPlateScale(), this.diagnostics);
		int threadsMax=Math.min(this.parameters.threadsMax, this.wavelengths.size());
		if (threadsMax<=1){
			ComplexFHT fht=new ComplexFHT();
			for (BigDecimal wave:this.wavelengths){
				cube.addImage(runWavelength(wave, fht));
			}
		} else {
			final Thread[] threads = newThreadArray(threadsMax);
			final AtomicInteger ai = new AtomicInteger(0);
			final AtomicReference<Throwable> failure=new AtomicReference<Throwable>();
			for (int ithread = 0; ithread < threads.length; ithread++) {
				threads[ithread] = new Thread() {
					public void run() {
						ComplexFHT fht=new ComplexFHT(); // one per thread, not thread safe
						for (int nWave = ai.getAndIncrement(); nWave < wavelengths.size(); nWave = ai.getAndIncrement()) {
							if (failure.get()!=null) break;
							try {
								cube.setImage(nWave, runWavelength(wavelengths.get(nWave), fht));
							} catch (Throwable e){
								failure.compareAndSet(null, e);
								break;
							}
						}
					}
				};
			}
			startAndJoin(threads);
			Throwable e=failure.get();
			if (e instanceof RuntimeException) throw (RuntimeException) e;
			if (e instanceof Error) throw (Error) e;
			if (e!=null) throw new RuntimeException(e);
		}
		if (!cube.isComplete()) {
			throw new IllegalStateException("Simulation finished with an incomplete cube ("+cube.getNumberOfPlanes()+" of "+
					cube.getNumberOfWavelengths()+" planes)");
		}
		this.visualization.draw();
		this.diagnostics.debug(" Full simulation completed in "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3)+"s.");
		return cube;
	}

	/**
	 * Regrids the complete cube to the output plate scale (reference plate scale times the
	 * resampling factor) and crops it to the output half field of view.
	 * @throws SimulationAbortedException if the output grid would have no samples
	 */
	public void resampleOutput(SpectralCube cube){
		double factor=this.parameters.output.resamplingFactor;
		double hfov=this.parameters.output.hfov;
		double outputPscale=cube.getPlateScale()*factor;
		if (!(outputPscale>0) || !(hfov>0) || (Resampler.getOutputSize(outputPscale, hfov)<1)){
			SimulationError error=new SimulationError(SimulationError.Kind.INVALID_PARAMETER,
					"Output half field of view ("+hfov+"\") is smaller than half of the output plate scale ("+
					IJ.d2s(outputPscale,6)+"\"/sample), the resampled cube would be empty");
			this.diagnostics.critical(" "+error.getMessage());
			throw new SimulationAbortedException(error);
		}
		cube.resampleAndCrop(factor, hfov, this.resampler);
	}

	/**
	 * Simulates one wavelength
	 * @param wave wavelength, m
	 * @param fht transform instance owned by the calling thread, or null
	 * @return finalized composite of all slices
	 */
	public CompositeImage runWavelength(BigDecimal wave, ComplexFHT fht){
		if (this.referenceImage==null) prepare();
		if (fht==null) fht=new ComplexFHT();
		this.diagnostics.info(" !!! Processing for a wavelength of "+wave.movePointRight(9).toPlainString()+"nm...");
		Pupil pupil=Pupil.circular(this.sampling, this.gamma, this.pupilRadius, this.diagnostics);
		CompositeImage composite=new CompositeImage(pupil.getSize(), wave, this.nSlices);

		// match the plate scale of the reference wavelength
		Image image=pupil.toConjugateImage(wave, fht);
		plotImage("-> fft to image space", image);
		image=image.resample(this.referenceImage.getPlateScale(), this.referenceImage.getHFOV(), this.resampler);
		pupil=image.toConjugatePupil(fht);

		List<Image> slices=this.slicer.sliceUp(pupil.toConjugateImage(wave, fht));
		for (Image slice:slices){
			int sliceNumber=slice.getSliceNumber();
			Pupil slicePupil=slice.toConjugatePupil(fht);
			this.visualization.addImagePlot("-> take slice "+sliceNumber+" -> ifft to pupil space",
					slicePupil.getAmplitude(true, true), slicePupil.getSize(), slicePupil.getHalfExtent(), "mm");
			String titlePrefix="";
			if (this.parameters.general.doWfe){
				WfeMap wfe=loadWfe(wave, sliceNumber);
				SimulationError samplingError=SimulationPreflight.checkWfeSampling(wfe.sampling, this.sampling);
				if (samplingError!=null) {
					this.diagnostics.critical(" "+samplingError.getMessage());
					throw new SimulationAbortedException(samplingError);
				}
				this.visualization.addImagePlot("wfe (radians)", absolute(wfe.getPaddedPhaseCentered(slicePupil)),
						slicePupil.getSize(), slicePupil.getHalfExtent(), "mm");
				slicePupil=slicePupil.addToPhase(wfe.getPaddedPhase(slicePupil));
				titlePrefix="added phase error ";
				this.diagnostics.debug(" Added phase error for slice "+sliceNumber+".");
			}
			Image sliceImage=slicePupil.toConjugateImage(wave, fht);
			plotImage(titlePrefix+"-> fft to image space", sliceImage);
			composite.addSlice(sliceImage);
		}
		return composite;
	}

	private WfeMap loadWfe(BigDecimal wave, int sliceNumber){
		try {
			return this.wfeCatalogue.load(wave, sliceNumber, this.nSlices);
		} catch (IOException e){
			SimulationError error=new SimulationError(SimulationError.Kind.WFE_READ_ERROR, e.getMessage());
			this.diagnostics.critical(" "+error.getMessage());
			throw new SimulationAbortedException(error);
		}
	}

	private void plotImage(String title, Image image){
		Image.Plane plane=image.getAmplitudeScaledByAiryDiameters(3, true);
		this.visualization.addImagePlot(title, plane.pixels, plane.width, plane.halfExtent, "arcsec");
	}

	private static double [] absolute(double [] data){
		double [] result=new double[data.length];
		for (int i=0;i<data.length;i++) result[i]=Math.abs(data[i]);
		return result;
	}

	public List<BigDecimal> getWavelengths(){
		return this.wavelengths;
	}
	public Image getReferenceImage(){
		return this.referenceImage;
	}
	public Slicer getSlicer(){
		return this.slicer;
	}
	public WfeCatalogue getWfeCatalogue(){
		return this.wfeCatalogue;
	}

	private Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		return new Thread[n_cpus];
	}

	/* Start all given threads and wait on each of them until all are done. */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}

		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			throw new RuntimeException(ie);
		}
	}
}

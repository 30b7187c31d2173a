/**
 **
 ** CubeWriter.java - saves the spectral cube as a FITS or TIFF stack
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CubeWriter.java is free software: you can redistribute it and/or modify
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

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.measure.Calibration;

/**
 * Converts the cube into a 32-bit ImageJ stack (one slice per wavelength) and saves it.
 * Files ending with .fits/.fit are written as FITS, anything else as a TIFF stack.
 */
public class CubeWriter {
	private final SimulationDiagnostics diagnostics;

	public CubeWriter(SimulationDiagnostics diagnostics){
		this.diagnostics=diagnostics;
	}

	public static ImagePlus toImagePlus(SpectralCube cube, String title){
		int width=cube.getWidth();
		ImageStack stack=new ImageStack(width,width);
		StringBuilder info=new StringBuilder();
		info.append("PSCALE = ").append(cube.getPlateScale()).append(" / arcsec per sample\n");
		info.append("HFOV = ").append(cube.getHFOV()).append(" / arcsec\n");
		for (int n=0;n<cube.getNumberOfWavelengths();n++){
			double [] plane=cube.getPlane(n);
			float [] fpixels=new float[width*width];
			if (plane!=null) for (int i=0;i<fpixels.length;i++) fpixels[i]=(float) plane[i];
			BigDecimal wave=cube.getWavelength(n);
			String label=(wave==null)?("plane-"+n):(wave.movePointRight(9).stripTrailingZeros().toPlainString()+"nm");
			stack.addSlice(label, fpixels);
			info.append("WAVE").append(n+1).append(" = ").append((wave==null)?"":wave.toPlainString()).append(" / m\n");
		}
		ImagePlus imp=new ImagePlus(title, stack);
		Calibration cal=imp.getCalibration();
		cal.pixelWidth=cube.getPlateScale();
		cal.pixelHeight=cube.getPlateScale();
		cal.setUnit("arcsec");
		imp.setProperty("Info", info.toString());
		imp.getProcessor().resetMinAndMax();
		return imp;
	}

	/**
	 * @param cube complete cube
	 * @param path output file
	 * @throws IOException if ImageJ could not write the file
	 */
	public void write(SpectralCube cube, String path) throws IOException {
		if (!cube.isComplete()) {
			throw new IllegalStateException("Cube has "+cube.getNumberOfPlanes()+" of "+cube.getNumberOfWavelengths()+" planes");
		}
		ImagePlus imp=toImagePlus(cube, new File(path).getName());
		FileSaver fs=new FileSaver(imp);
		String lower=path.toLowerCase();
		boolean ok;
		if (lower.endsWith(".fits") || lower.endsWith(".fit")) {
			ok=fs.saveAsFits(path);
		} else if (imp.getStackSize()>1) {
			ok=fs.saveAsTiffStack(path);
		} else {
			ok=fs.saveAsTiff(path);
		}
		if (!ok) throw new IOException("Failed to write cube to "+path);
		if (this.diagnostics!=null) {
			this.diagnostics.info(" Wrote "+imp.getStackSize()+" plane cube ("+cube.getWidth()+"x"+cube.getWidth()+") to "+path);
		}
	}

	/** reads back a cube written as TIFF, null if the file can not be opened */
	public static ImagePlus read(String path){
		return IJ.openImage(path);
	}
}

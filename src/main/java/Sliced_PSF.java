/**
 **
 ** Sliced_PSF.java - ImageJ plugin running the sliced PSF simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Sliced_PSF.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.configuration.ConfigurationException;

import ij.IJ;
import ij.ImageJ;
import ij.ImagePlus;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;

public class Sliced_PSF implements PlugIn {
	static String  configPath="sliced-psf.xml";
	static boolean plot=false;
	static boolean saveCube=false;
	static int     threadsMax=1;
	static int     debugLevel=1;

	public void run(String arg) {
		if (!showDialog()) return;
		SlicedPsfParameters parameters=new SlicedPsfParameters();
		try {
			parameters.loadFromXML(configPath);
		} catch (ConfigurationException e) {
			IJ.showMessage("Sliced_PSF Error","Can not read "+configPath+":\n"+e.getMessage());
			return;
		}
		parameters.threadsMax=threadsMax;
		parameters.debugLevel=debugLevel;
		ConsoleDiagnostics diagnostics=new ConsoleDiagnostics(debugLevel);
		PsfVisualization visualization=plot?new ImageJVisualization("sliced PSF"):PsfVisualization.NONE;
		SlicedPsfSimulation simulation=new SlicedPsfSimulation(parameters, diagnostics, visualization);
		SpectralCube cube;
		try {
			IJ.showStatus("Simulating sliced PSF...");
			cube=simulation.run();
			if (saveCube) {
				simulation.resampleOutput(cube);
				new CubeWriter(diagnostics).write(cube, parameters.output.filename);
			}
		} catch (SimulationAbortedException e) {
			IJ.showMessage("Sliced_PSF Error",e.getMessage());
			return;
		} catch (IOException e) {
			IJ.showMessage("Sliced_PSF Error",e.getMessage());
			return;
		} finally {
			IJ.showStatus("");
		}
		ImagePlus imp=CubeWriter.toImagePlus(cube, "sliced-psf-cube");
		imp.show();
	}

	public boolean showDialog() {
		GenericDialog gd = new GenericDialog("Sliced PSF simulation");
		gd.addStringField ("Configuration file (.xml)",              configPath, 40);
		gd.addCheckbox    ("Show intermediate planes",               plot);
		gd.addCheckbox    ("Resample, crop and save the cube",       saveCube);
		gd.addNumericField("Wavelengths simulated in parallel",      threadsMax, 0);
		gd.addNumericField("Debug level",                            debugLevel, 0);
		gd.showDialog();
		if (gd.wasCanceled()) return false;
		configPath=                   gd.getNextString();
		plot=                         gd.getNextBoolean();
		saveCube=                     gd.getNextBoolean();
		threadsMax=             (int) gd.getNextNumber();
		debugLevel=             (int) gd.getNextNumber();
		return true;
	}

	public static void main(String[] args) {
		// set the plugins.dir property to make the plugin appear in the Plugins menu
		Class<?> clazz = Sliced_PSF.class;
		String url = clazz.getResource("/" + clazz.getName().replace('.', '/') + ".class").toString();
		String pluginsDir = url.substring(5, url.length() - clazz.getName().length() - 6);
		System.setProperty("plugins.dir", pluginsDir);
		// start ImageJ
		new ImageJ();
		// run the plugin
		IJ.runPlugIn(clazz.getName(), "");
	}
}

/**
 **
 ** SlicedPsfCommand.java - command line entry point of the sliced PSF simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SlicedPsfCommand.java is free software: you can redistribute it and/or modify
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
import java.io.PrintStream;
import java.util.Locale;

import org.apache.commons.configuration.ConfigurationException;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import ij.ImageJ;

public class SlicedPsfCommand {

	@Option(name = "-c", usage = "simulation configuration file path (.xml)")
	private String configPath = "sliced-psf.xml";

	@Option(name = "-p", usage = "plot intermediate planes")
	private boolean plot;

	@Option(name = "-f", usage = "resample, crop and write the cube")
	private boolean writeCube;

	@Option(name = "-fn", usage = "cube file name (.fits or .tif), overrides the configuration")
	private String filename;

	@Option(name = "-v", usage = "verbose")
	private boolean verbose;

	@Option(name = "-threads", usage = "maximal number of wavelengths simulated in parallel")
	private int threads = 0;

	@Option(name = "-help", aliases = {"--help", "-h", "-?"}, usage = "Display help.")
	private boolean help;

	private static void usage(CmdLineParser parser, PrintStream stream, boolean full) {
		stream.println("Usage: slicedpsf [OPTIONS]");
		if (full) {
			stream.println("Options:");
			parser.getProperties().withUsageWidth(80);
			parser.printUsage(stream);
		} else {
			stream.println("Try option -help for a more complete description of options.");
		}
	}

	/**
	 * Runs the command
	 * @return process exit code, 0 on success
	 */
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		SlicedPsfCommand job = new SlicedPsfCommand();
		CmdLineParser parser = new CmdLineParser(job);
		try {
			parser.parseArgument(args);
		} catch (CmdLineException e) {
			err.format("Error: %s\n", e.getMessage());
			usage(parser, err, false);
			return 1;
		}
		if (job.help) {
			usage(parser, out, true);
			return 0;
		}

		SlicedPsfParameters parameters = new SlicedPsfParameters();
		try {
			parameters.loadFromXML(job.configPath);
		} catch (ConfigurationException e) {
			err.format("Error: can not read configuration %s: %s\n", job.configPath, e.getMessage());
			return 1;
		}
		if (job.verbose) parameters.debugLevel = Math.max(parameters.debugLevel, 2);
		if (job.threads > 0) parameters.threadsMax = job.threads;
		if (job.filename != null) parameters.output.filename = job.filename;

		ConsoleDiagnostics diagnostics = new ConsoleDiagnostics(parameters.debugLevel, out, err);
		PsfVisualization visualization = PsfVisualization.NONE;
		if (job.plot) {
			new ImageJ();
			visualization = new ImageJVisualization("sliced PSF");
		}
		SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, visualization);
		try {
			SpectralCube cube = simulation.run();
			if (job.writeCube) {
				simulation.resampleOutput(cube);
				new CubeWriter(diagnostics).write(cube, parameters.output.filename);
			}
		} catch (SimulationAbortedException e) {
			diagnostics.critical(" " + e.getMessage());
			return 1;
		} catch (IOException e) {
			diagnostics.critical(" " + e.getMessage());
			return 1;
		}
		return 0;
	}

	public static void main(String[] args) {
		// Switch to "US" locale to avoid problems with number formats.
		Locale.setDefault(Locale.US);
		int code = execute(args, System.out, System.err);
		if (code != 0) System.exit(code);
	}
}

/**
 **
 ** ComplexFHT - complex 2-d Fourier transform of square fields,
 ** calculated with two real Fast Hartley Transforms for power of 2 sizes
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ComplexFHT.java is free software: you can redistribute it and/or modify
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
 * Complex fields are kept as {re[],im[]} pairs of flattened square arrays (row-major, size*size).
 * Both directions are unitary (scaled by 1/size), so Parseval holds and forward followed
 * by inverse reproduces the input. Zero frequency is at index 0 on output of forward();
 * use swapQuadrants() to move it to (size/2, size/2).
 * Power of 2 sides use the FHT, other even sides fall back to a (slow) separable direct DFT.
 * Instances cache trigonometric tables and are not thread safe - use one per thread.
 */
public class ComplexFHT {
	private int maxN=-1; // undefined
	private double[] C;
	private double[] S;
	private int[] bitrev;
	private double[] tempArr;

	public static boolean isPowerOfTwo(int n) {
		if (n<1) return false;
		return (n & (n-1))==0;
	}

	/** true if the array is a square with a power of 2 side (at least 4) */
	public static boolean powerOf2Size(int len) {
		int i=16;
		while(i<len) i *= 4;
		return i==len;
	}

	/** Swap quadrants 0<->3 and 1<->2 in place - moves DC between index 0 and the array center */
	public static void swapQuadrants(double [] data) {
		if (data==null) return;
		int size= (int) Math.sqrt(data.length);
		int hsize=size/2;
		int shift03=(size+1)*hsize;
		int shift12=(size-1)*hsize;
		int i,j,index;
		double d;
		for (i=0;i<hsize;i++)  for (j=0;j<hsize;j++) {
			index=i*size+j;
			d=data[index];
			data[index]=data[index+shift03];
			data[index+shift03]=d;
			index+=hsize;
			d=data[index];
			data[index]=data[index+shift12];
			data[index+shift12]=d;
		}
	}

	public static void swapQuadrants(double [][] reIm) {
		swapQuadrants(reIm[0]);
		swapQuadrants(reIm[1]);
	}

	/**
	 * Forward unitary transform, F(u,v) = 1/N * sum f(x,y)*exp(-2*pi*i*(ux+vy)/N)
	 * @param reIm input field {re,im}, not modified
	 * @return new {re,im} arrays, DC at index 0
	 */
	public double [][] forward(double [][] reIm) {
		return complexTransform(reIm, false);
	}

	/**
	 * Inverse unitary transform, f(x,y) = 1/N * sum F(u,v)*exp(2*pi*i*(ux+vy)/N)
	 * @param reIm input spectrum {re,im} with DC at index 0, not modified
	 * @return new {re,im} arrays
	 */
	public double [][] inverse(double [][] reIm) {
		return complexTransform(reIm, true);
	}

	private double [][] complexTransform(double [][] reIm, boolean inverse) {
		if ((reIm==null) || (reIm.length!=2) || (reIm[0].length!=reIm[1].length)) {
			throw new IllegalArgumentException ("complex field should be a {re,im} pair of equal length arrays");
		}
		int size=(int) Math.round(Math.sqrt(reIm[0].length));
		if ((size*size!=reIm[0].length) || (size<2) || ((size & 1)!=0)) {
			throw new IllegalArgumentException ("complex field should be a square with even side (length="+reIm[0].length+")");
		}
		if (!powerOf2Size(reIm[0].length)) return directTransform(reIm, size, inverse);
		updateMaxN(reIm[0]);
		int n=this.maxN;
		double [] hRe=reIm[0].clone();
		double [] hIm=reIm[1].clone();
		rc2DFHT(hRe, inverse, n);
		rc2DFHT(hIm, inverse, n);
		// Hartley -> Fourier: even part E=(H(k)+H(-k))/2 is the cosine sum, odd part O=(H(k)-H(-k))/2 - the sine sum
		double scale=inverse?n:(1.0/n); // inverse FHT already divided by n*n
		double [][] result=new double [2][n*n];
		for (int row=0;row<n;row++) {
			int mRow=(n-row)%n;
			for (int col=0;col<n;col++) {
				int mCol=(n-col)%n;
				int index=row*n+col;
				int indexMod=mRow*n+mCol;
				double eRe=0.5*(hRe[index]+hRe[indexMod]);
				double oRe=0.5*(hRe[index]-hRe[indexMod]);
				double eIm=0.5*(hIm[index]+hIm[indexMod]);
				double oIm=0.5*(hIm[index]-hIm[indexMod]);
				if (inverse) {
					result[0][index]=scale*(eRe-oIm);
					result[1][index]=scale*(oRe+eIm);
				} else {
					result[0][index]=scale*(eRe+oIm);
					result[1][index]=scale*(eIm-oRe);
				}
			}
		}
		return result;
	}

	/** separable DFT for sides that are not a power of 2, O(size^3) */
	private double [][] directTransform(double [][] reIm, int n, boolean inverse) {
		double [] cos=new double[n];
		double [] sin=new double[n];
		for (int k=0;k<n;k++){
			cos[k]=Math.cos(2.0*Math.PI*k/n);
			sin[k]=(inverse?1.0:-1.0)*Math.sin(2.0*Math.PI*k/n);
		}
		double scale=1.0/Math.sqrt(n); // per axis
		double [][] rows=new double [2][n*n];
		for (int row=0;row<n;row++) {
			int base=row*n;
			for (int u=0;u<n;u++){
				double sRe=0.0,sIm=0.0;
				for (int x=0;x<n;x++){
					int k=(int) (((long) u*x)%n);
					double re=reIm[0][base+x];
					double im=reIm[1][base+x];
					sRe+=re*cos[k]-im*sin[k];
					sIm+=re*sin[k]+im*cos[k];
				}
				rows[0][base+u]=scale*sRe;
				rows[1][base+u]=scale*sIm;
			}
		}
		double [][] result=new double [2][n*n];
		for (int col=0;col<n;col++) {
			for (int v=0;v<n;v++){
				double sRe=0.0,sIm=0.0;
				for (int y=0;y<n;y++){
					int k=(int) (((long) v*y)%n);
					double re=rows[0][y*n+col];
					double im=rows[1][y*n+col];
					sRe+=re*cos[k]-im*sin[k];
					sIm+=re*sin[k]+im*cos[k];
				}
				result[0][v*n+col]=scale*sRe;
				result[1][v*n+col]=scale*sIm;
			}
		}
		return result;
	}

	private void updateMaxN(double [] data){
		if (!powerOf2Size(data.length)) {
			String msg="Field is not a square of power of 2 size (length="+data.length+")";
			throw new IllegalArgumentException (msg);
		}
		int n=(int) Math.sqrt(data.length);
		if (n!=this.maxN) {
			this.maxN=n;
			makeSinCosTables(n);
			makeBitReverseTable(n);
			this.tempArr=new double[n];
		}
	}

	private void makeSinCosTables(int maxN) {
		int n = maxN/4;
		this.C = new double[n];
		this.S = new double[n];
		double theta = 0.0;
		double dTheta = 2.0 * Math.PI/maxN;
		for (int i=0; i<n; i++) {
			this.C[i] = Math.cos(theta);
			this.S[i] = Math.sin(theta);
			theta += dTheta;
		}
	}

	private void makeBitReverseTable(int maxN) {
		this.bitrev = new int[maxN];
		int nLog2 = log2(maxN);
		for (int i=0; i<maxN; i++)
			this.bitrev[i] = bitRevX(i, nLog2);
	}

	/** 2D FHT, row-column transform followed by the Bracewell correction */
	private void rc2DFHT(double[] x, boolean inverse, int maxN) {
		for (int row=0; row<maxN; row++)
			dfht3(x, row*maxN, inverse, maxN);
		transposeR(x, maxN);
		for (int row=0; row<maxN; row++)
			dfht3(x, row*maxN, inverse, maxN);
		transposeR(x, maxN);

		int mRow, mCol;
		double A,B,C,D,E;
		for (int row=0; row<=maxN/2; row++) {
			for (int col=0; col<=maxN/2; col++) {
				mRow = (maxN - row) % maxN;
				mCol = (maxN - col)  % maxN;
				A = x[row * maxN + col];	//  see Bracewell, 'Fast 2D Hartley Transf.' IEEE Procs. 9/86
				B = x[mRow * maxN + col];
				C = x[row * maxN + mCol];
				D = x[mRow * maxN + mCol];
				E = ((A + D) - (B + C)) / 2;
				x[row * maxN + col] = A - E;
				x[mRow * maxN + col] = B + E;
				x[row * maxN + mCol] = C + E;
				x[mRow * maxN + mCol] = D - E;
			}
		}
	}

	/** 1D FHT of one row, radix-4 first stages */
	private void dfht3 (double[] x, int base, boolean inverse, int maxN) {
		int i, stage, gpNum, gpSize, numGps, Nlog2;
		int bfNum, numBfs;
		int Ad0, Ad1, Ad2, Ad3, Ad4, CSAd;
		double rt1, rt2, rt3, rt4;

		Nlog2 = log2(maxN);
		bitRevRArr(x, base, maxN);
		gpSize = 2;
		numGps = maxN / 4;
		for (gpNum=0; gpNum<numGps; gpNum++)  {
			Ad1 = gpNum * 4;
			Ad2 = Ad1 + 1;
			Ad3 = Ad1 + gpSize;
			Ad4 = Ad2 + gpSize;
			rt1 = x[base+Ad1] + x[base+Ad2];   // a + b
			rt2 = x[base+Ad1] - x[base+Ad2];   // a - b
			rt3 = x[base+Ad3] + x[base+Ad4];   // c + d
			rt4 = x[base+Ad3] - x[base+Ad4];   // c - d
			x[base+Ad1] = rt1 + rt3;      // a + b + (c + d)
			x[base+Ad2] = rt2 + rt4;      // a - b + (c - d)
			x[base+Ad3] = rt1 - rt3;      // a + b - (c + d)
			x[base+Ad4] = rt2 - rt4;      // a - b - (c - d)
		}

		if (Nlog2 > 2) {
			gpSize = 4;
			numBfs = 2;
			numGps = numGps / 2;
			for (stage=2; stage<Nlog2; stage++) {
				for (gpNum=0; gpNum<numGps; gpNum++) {
					Ad0 = gpNum * gpSize * 2;
					Ad1 = Ad0;     // 1st butterfly is different from others - no mults needed
					Ad2 = Ad1 + gpSize;
					Ad3 = Ad1 + gpSize / 2;
					Ad4 = Ad3 + gpSize;
					rt1 = x[base+Ad1];
					x[base+Ad1] = x[base+Ad1] + x[base+Ad2];
					x[base+Ad2] = rt1 - x[base+Ad2];
					rt1 = x[base+Ad3];
					x[base+Ad3] = x[base+Ad3] + x[base+Ad4];
					x[base+Ad4] = rt1 - x[base+Ad4];
					for (bfNum=1; bfNum<numBfs; bfNum++) {
						Ad1 = bfNum + Ad0;
						Ad2 = Ad1 + gpSize;
						Ad3 = gpSize - bfNum + Ad0;
						Ad4 = Ad3 + gpSize;

						CSAd = bfNum * numGps;
						rt1 = x[base+Ad2] * this.C[CSAd] + x[base+Ad4] * this.S[CSAd];
						rt2 = x[base+Ad4] * this.C[CSAd] - x[base+Ad2] * this.S[CSAd];

						x[base+Ad2] = x[base+Ad1] - rt1;
						x[base+Ad1] = x[base+Ad1] + rt1;
						x[base+Ad4] = x[base+Ad3] + rt2;
						x[base+Ad3] = x[base+Ad3] - rt2;
					}
				}
				gpSize *= 2;
				numBfs *= 2;
				numGps = numGps / 2;
			}
		}

		if (inverse)  {
			for (i=0; i<maxN; i++)
				x[base+i] = x[base+i] / maxN;
		}
	}

	private void transposeR (double[] x, int maxN) {
		int r, c;
		double rTemp;
		for (r=0; r<maxN; r++)  {
			for (c=r+1; c<maxN; c++) {
				rTemp = x[r*maxN + c];
				x[r*maxN + c] = x[c*maxN + r];
				x[c*maxN + r] = rTemp;
			}
		}
	}

	private int log2 (int x) {
		int count = 30;
		while ((x & (1<<count))==0)
			count--;
		return count;
	}

	private void bitRevRArr (double[] x, int base, int maxN) {
		for (int i=0; i<maxN; i++)
			this.tempArr[i] = x[base+this.bitrev[i]];
		for (int i=0; i<maxN; i++)
			x[base+i] = this.tempArr[i];
	}

	private int bitRevX (int  x, int bitlen) {
		int  temp = 0;
		for (int i=0; i<=bitlen; i++)
			if ((x & (1<<i)) !=0)
				temp  |= (1<<(bitlen-i-1));
		return temp;
	}
}

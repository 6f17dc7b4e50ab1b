/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.construction.simulation.assembly;

/**
 * The converged product of a homology assembly and whether its ends were found to close into a circle.
 */
public class AssemblyProduct {
  private final String sequence;
  private final boolean circular;

  public AssemblyProduct(String sequence, boolean circular) {
    this.sequence = sequence;
    this.circular = circular;
  }

  public String getSequence() {
    return sequence;
  }

  public boolean isCircular() {
    return circular;
  }

  @Override
  public String toString() {
    return String.format("%s %d bp", circular ? "circular" : "linear", sequence.length());
  }
}

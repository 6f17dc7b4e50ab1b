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

package com.twentyn.construction.exceptions;

/**
 * Thrown when the 3' anneal region of a PCR oligo has no exact match on the template.  The role is either
 * "forward" or "reverse".
 */
public class AnnealMismatchException extends ConstructionException {
  private final String role;
  private final String oligo;

  public AnnealMismatchException(String role, String oligo, String annealRegion) {
    super(String.format("The %s oligo %s does not anneal to the template (no exact match for %s)",
        role, oligo, annealRegion));
    this.role = role;
    this.oligo = oligo;
  }

  public String getRole() {
    return role;
  }

  public String getOligo() {
    return oligo;
  }
}

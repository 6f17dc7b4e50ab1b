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

package com.twentyn.construction.model;

/**
 * The five kinds of construction step.  Several input keywords can map onto one kind: "gibson" and "goldengate" are
 * both ASSEMBLE, "blunt" is a LIGATE.
 */
public enum Operation {
  PCR("PCR"),
  DIGEST("Digest"),
  LIGATE("Ligate"),
  ASSEMBLE("Assemble"),
  TRANSFORM("Transform"),
  ;

  private final String keyword;

  Operation(String keyword) {
    this.keyword = keyword;
  }

  // The canonical keyword written back out by the serializer.
  public String getKeyword() {
    return keyword;
  }
}

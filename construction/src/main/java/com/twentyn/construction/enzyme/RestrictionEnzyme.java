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

package com.twentyn.construction.enzyme;

import com.twentyn.construction.exceptions.UnrecognizedSequenceException;
import com.twentyn.construction.sequence.SequenceUtils;

import java.util.Objects;

/**
 * A restriction enzyme: its recognition site and the two strand-cut positions.
 *
 * cut5 and cut3 are signed offsets, in bp, from the end (3' side) of the recognition site to the cut on the top and
 * bottom strand respectively.  BsaI, GGTCTC(1/5), is {1, 5}; EcoRI, G^AATTC, is {-5, -1}; PstI, CTGCA^G, is {-1, -5}.
 */
public class RestrictionEnzyme {
  private final String name;
  private final String recognitionSequence;
  private final String recognitionRC;
  private final int cut5;
  private final int cut3;

  public RestrictionEnzyme(String name, String recognitionSequence, int cut5, int cut3)
      throws UnrecognizedSequenceException {
    this.name = name;
    this.recognitionSequence = SequenceUtils.resolveSequence(recognitionSequence);
    this.recognitionRC = SequenceUtils.reverseComplement(this.recognitionSequence);
    this.cut5 = cut5;
    this.cut3 = cut3;
  }

  public String getName() {
    return name;
  }

  public String getRecognitionSequence() {
    return recognitionSequence;
  }

  public String getRecognitionRC() {
    return recognitionRC;
  }

  public int getCut5() {
    return cut5;
  }

  public int getCut3() {
    return cut3;
  }

  // True iff the enzyme leaves a 5' overhang.
  public boolean isFivePrime() {
    return cut5 < cut3;
  }

  public boolean isBlunt() {
    return cut5 == cut3;
  }

  public int getOverhangLength() {
    return Math.abs(cut3 - cut5);
  }

  public boolean isPalindromicSite() {
    return recognitionSequence.equals(recognitionRC);
  }

  /**
   * Top-strand coordinates [start, end) of the overhang produced by a forward-orientation site starting at siteStart.
   */
  public int[] forwardCutRegion(int siteStart) {
    int siteEnd = siteStart + recognitionSequence.length();
    return new int[] {siteEnd + Math.min(cut5, cut3), siteEnd + Math.max(cut5, cut3)};
  }

  /**
   * Top-strand coordinates [start, end) of the overhang produced by a reverse-orientation site, i.e. an occurrence of
   * recognitionRC starting at siteStart.  The enzyme reads the bottom strand here, so it cuts upstream of the site.
   */
  public int[] reverseCutRegion(int siteStart) {
    return new int[] {siteStart - Math.max(cut5, cut3), siteStart - Math.min(cut5, cut3)};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    RestrictionEnzyme that = (RestrictionEnzyme) o;
    return cut5 == that.cut5 &&
        cut3 == that.cut3 &&
        Objects.equals(name, that.name) &&
        Objects.equals(recognitionSequence, that.recognitionSequence);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, recognitionSequence, cut5, cut3);
  }

  @Override
  public String toString() {
    return String.format("%s %s(%d/%d)", name, recognitionSequence, cut5, cut3);
  }
}

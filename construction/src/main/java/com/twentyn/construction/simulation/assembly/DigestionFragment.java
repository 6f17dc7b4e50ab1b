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

import java.util.Objects;

/**
 * A fragment with single-stranded overhangs at both ends.  The overhangs are given as top-strand sequence and are not
 * part of {@link #getFragment()}.
 */
public class DigestionFragment {
  private final String fragment;
  private final String stickyEnd5;
  private final String stickyEnd3;

  public DigestionFragment(String fragment, String stickyEnd5, String stickyEnd3) {
    this.fragment = fragment;
    this.stickyEnd5 = stickyEnd5;
    this.stickyEnd3 = stickyEnd3;
  }

  public String getFragment() {
    return fragment;
  }

  public String getStickyEnd5() {
    return stickyEnd5;
  }

  public String getStickyEnd3() {
    return stickyEnd3;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DigestionFragment that = (DigestionFragment) o;
    return Objects.equals(fragment, that.fragment) &&
        Objects.equals(stickyEnd5, that.stickyEnd5) &&
        Objects.equals(stickyEnd3, that.stickyEnd3);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fragment, stickyEnd5, stickyEnd3);
  }

  @Override
  public String toString() {
    return String.format("%s-[%d bp]-%s", stickyEnd5, fragment.length(), stickyEnd3);
  }
}

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

import com.twentyn.construction.config.EnzymeDefinition;
import com.twentyn.construction.exceptions.UnrecognizedSequenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only table of restriction enzymes keyed by case-insensitive name.  Built once before any simulation and handed
 * to every component that needs it; instances never change after construction, so they can be shared across threads.
 */
public class EnzymeRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(EnzymeRegistry.class);

  private final Map<String, RestrictionEnzyme> enzymes;

  public EnzymeRegistry(Collection<RestrictionEnzyme> enzymes) {
    Map<String, RestrictionEnzyme> byName = new LinkedHashMap<>();
    for (RestrictionEnzyme enzyme : enzymes) {
      byName.put(normalize(enzyme.getName()), enzyme);
    }
    this.enzymes = Collections.unmodifiableMap(byName);
  }

  /**
   * The built-in enzymes: the Type IIS enzymes used for Golden Gate plus the common cloning enzymes.
   */
  public static EnzymeRegistry defaultRegistry() {
    return new EnzymeRegistry(defaultEnzymes());
  }

  /**
   * The built-in enzymes with additional definitions layered on top; a definition whose name matches a built-in
   * enzyme replaces it.
   */
  public static EnzymeRegistry withAdditionalEnzymes(List<EnzymeDefinition> definitions)
      throws UnrecognizedSequenceException {
    List<RestrictionEnzyme> all = new ArrayList<>(defaultEnzymes());
    if (definitions != null) {
      for (EnzymeDefinition def : definitions) {
        LOGGER.debug("Registering enzyme %s %s(%d/%d)", def.getName(), def.getRecognitionSequence(),
            def.getCut5(), def.getCut3());
        all.add(def.toEnzyme());
      }
    }
    return new EnzymeRegistry(all);
  }

  public boolean contains(String name) {
    return name != null && enzymes.containsKey(normalize(name));
  }

  /**
   * @return The enzyme, or null when the name is unknown.
   */
  public RestrictionEnzyme get(String name) {
    return name == null ? null : enzymes.get(normalize(name));
  }

  public Collection<RestrictionEnzyme> getEnzymes() {
    return enzymes.values();
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase();
  }

  private static List<RestrictionEnzyme> defaultEnzymes() {
    List<RestrictionEnzyme> out = new ArrayList<>();
    try {
      // Type IIS
      out.add(new RestrictionEnzyme("BsaI", "GGTCTC", 1, 5));
      out.add(new RestrictionEnzyme("BsmBI", "CGTCTC", 1, 5));
      out.add(new RestrictionEnzyme("BbsI", "GAAGAC", 2, 6));
      out.add(new RestrictionEnzyme("AarI", "CACCTGC", 4, 8));
      // Palindromic cutters
      out.add(new RestrictionEnzyme("EcoRI", "GAATTC", -5, -1));
      out.add(new RestrictionEnzyme("BamHI", "GGATCC", -5, -1));
      out.add(new RestrictionEnzyme("BglII", "AGATCT", -5, -1));
      out.add(new RestrictionEnzyme("XbaI", "TCTAGA", -5, -1));
      out.add(new RestrictionEnzyme("SpeI", "ACTAGT", -5, -1));
      out.add(new RestrictionEnzyme("XhoI", "CTCGAG", -5, -1));
      out.add(new RestrictionEnzyme("MfeI", "CAATTG", -5, -1));
      out.add(new RestrictionEnzyme("HindIII", "AAGCTT", -5, -1));
      out.add(new RestrictionEnzyme("SalI", "GTCGAC", -5, -1));
      out.add(new RestrictionEnzyme("NotI", "GCGGCCGC", -6, -2));
      out.add(new RestrictionEnzyme("PstI", "CTGCAG", -1, -5));
      out.add(new RestrictionEnzyme("SphI", "GCATGC", -1, -5));
      out.add(new RestrictionEnzyme("EcoRV", "GATATC", -3, -3));
    } catch (UnrecognizedSequenceException e) {
      // The table above is constant; reaching this is a programming error.
      throw new IllegalStateException("Built-in enzyme table is invalid", e);
    }
    return out;
  }
}

/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.taxonomy;

import com.acme.evidence.model.Enums.DurabilityClass;
import com.acme.evidence.model.Enums.SeverityTier;

/**
 * The keyword tables the scorer classifies against. Entries are matched in the
 * order listed here, so each table keeps its more specific categories first.
 */
public final class Taxonomies {
    private Taxonomies() {}

    public static final TaxonomyTable<OrganDomain> ORGAN_DOMAINS = TaxonomyTable.<OrganDomain>builder("organ-domain")
            .entry(OrganDomain.MUSCULOSKELETAL,
                    "joint", "arthritis", "arthralgia", "synovitis", "sjc", "tjc", "das28", "das-28",
                    "acr20", "acr50", "acr70", "acr response", "cdai", "sdai", "rapid3", "eular response",
                    "haq", "physical function", "morning stiffness", "basdai", "basfi", "asdas",
                    "enthesitis", "dactylitis", "myositis", "muscle", "mmt8", "creatine kinase",
                    "bone erosion", "sharp score", "gout", "uric acid", "tendon")
            .entry(OrganDomain.MUCOCUTANEOUS,
                    "skin", "cutaneous", "rash", "erythema", "clasi", "cdasi", "pasi", "body surface area",
                    "investigator global", "iga 0/1", "napsi", "easi", "scorad", "poem", "eczema", "pruritus",
                    "itch", "alopecia", "hair", "salt score", "salt50", "salt75", "salt90", "regrowth",
                    "vitiligo", "vasi", "repigmentation", "hidradenitis", "ihs4", "mrss", "rodnan",
                    "digital ulcer", "raynaud", "oral ulcer", "aphthous", "wound", "urticaria",
                    "pemphigus", "pemphigoid", "pyoderma")
            .entry(OrganDomain.RENAL,
                    "kidney", "renal", "nephritis", "nephropathy", "glomerul", "proteinuria", "upcr", "uacr",
                    "albuminuria", "creatinine", "egfr", "gfr", "dialysis", "hematuria")
            .entry(OrganDomain.NEUROLOGICAL,
                    "neuro", "cognitive", "cognition", "memory", "mmse", "moca", "seizure", "epilep",
                    "headache", "migraine", "stroke", "neuropathy", "myelitis", "edss", "expanded disability",
                    "relapse rate", "annualized relapse", "mri lesion", "t2 lesion", "gadolinium",
                    "brain volume", "sdmt", "demyelinat", "myasthenia", "ataxia", "chorea", "psychosis")
            .entry(OrganDomain.HEMATOLOGICAL,
                    "anemia", "anaemia", "hemoglobin", "haemoglobin", "hemoly", "coombs", "reticulocyte",
                    "leukopenia", "lymphopenia", "neutropenia", "neutrophil count", "thrombocytopenia",
                    "platelet", "cytopenia", "bone marrow", "coagul", "bleeding", "antiphospholipid",
                    "evans syndrome", "hemophagocytic")
            .entry(OrganDomain.CARDIOPULMONARY,
                    "cardiac", "heart", "cardiovascular", "myocard", "ejection fraction", "lvef", "pericard",
                    "arrhythmia", "vasculitis", "arteritis", "aortitis", "coronary", "lung", "pulmonary",
                    "respiratory", "interstitial", "fvc", "forced vital capacity", "fev1", "dlco", "6mwd",
                    "6-minute walk", "six minute walk", "pleur", "pneumonitis", "dyspnea")
            .entry(OrganDomain.IMMUNOLOGICAL,
                    "complement", "autoantibod", "antibody", "antinuclear", "dsdna", "anca", "anti-ccp",
                    "rheumatoid factor", "crp", "c-reactive", "esr", "sedimentation rate", "ferritin",
                    "immunoglobulin", "igg", "interferon", "cytokine", "il-6", "interleukin", "b cell",
                    "cd19", "cd20", "t cell", "serolog")
            .entry(OrganDomain.SYSTEMIC,
                    "sledai", "bilag", "sri-4", "sri-5", "sri response", "bicla", "lldas", "doris", "slicc",
                    "damage index", "bvas", "disease activity", "physician global", "patient global", "pga",
                    "remission", "flare", "responder", "response", "improvement", "steroid",
                    "glucocorticoid", "prednison", "quality of life", "qol", "sf-36", "sf36", "eq-5d", "eq5d",
                    "facit", "dlqi")
            .entry(OrganDomain.GASTROINTESTINAL,
                    "gastrointestinal", "bowel", "intestinal", "abdominal", "mayo", "harvey-bradshaw",
                    "ses-cd", "ibdq", "calprotectin", "endoscopic", "mucosal healing", "colitis", "crohn",
                    "ileitis", "proctitis", "pouchitis", "fistula", "diarrhea", "stool frequency", "hepatic",
                    "liver", "transaminase", "bilirubin", "hepatitis", "dysphagia", "esophag", "pancreatitis")
            .entry(OrganDomain.OCULAR,
                    "eye", "ocular", "uveitis", "iritis", "scleritis", "retin", "optic neuritis",
                    "visual acuity", "bcva", "vitreous haze", "anterior chamber", "macular", "keratitis",
                    "conjunctivitis")
            .entry(OrganDomain.CONSTITUTIONAL,
                    "fatigue", "tiredness", "asthenia", "malaise", "fever", "febrile", "weight", "sleep",
                    "insomnia", "night sweats", "lymphadenopathy")
            .build();

    /** Generic instrument tiers used when no disease-specific instrument matches. */
    public static final TaxonomyTable<Integer> INSTRUMENT_QUALITY = TaxonomyTable.<Integer>builder("instrument-quality")
            .entry(10, "acr20", "acr50", "acr70", "acr90", "das28", "das-28", "sledai", "bilag", "pasi", "easi")
            .entry(9, "sdai", "cdai", "haq", "sri-4", "sri-5", "sri response", "clasi", "iga 0/1", "dlqi",
                    "scorad", "salt", "mayo", "ses-cd", "edss")
            .entry(8, "sf-36", "sf36", "eq-5d", "eq5d", "facit")
            .entry(7, "pain vas", "vas pain", "physician global", "patient global", "pga", "remission",
                    "responder", "response", "improvement")
            .build();

    public static final SafetyCategory DEATH =
            new SafetyCategory("death", "Fatal events", SeverityTier.CRITICAL, true, "Death");
    public static final SafetyCategory MALIGNANCY =
            new SafetyCategory("malignancy", "Malignant neoplasms", SeverityTier.CRITICAL, true, "Neoplasms");
    public static final SafetyCategory GI_PERFORATION =
            new SafetyCategory("gi_perforation", "GI perforation and bleeding", SeverityTier.HIGH, true, "Gastrointestinal disorders");
    public static final SafetyCategory THROMBOEMBOLIC =
            new SafetyCategory("thromboembolic", "Thromboembolic events", SeverityTier.HIGH, true, "Vascular disorders");
    public static final SafetyCategory CARDIOVASCULAR =
            new SafetyCategory("cardiovascular", "Major cardiovascular events", SeverityTier.HIGH, true, "Cardiac disorders");
    public static final SafetyCategory SERIOUS_INFECTION =
            new SafetyCategory("serious_infection", "Serious and opportunistic infections", SeverityTier.HIGH, true, "Infections and infestations");
    public static final SafetyCategory HEPATOTOXICITY =
            new SafetyCategory("hepatotoxicity", "Liver toxicity", SeverityTier.HIGH, true, "Hepatobiliary disorders");
    public static final SafetyCategory CYTOPENIA =
            new SafetyCategory("cytopenia", "Blood cell deficiencies", SeverityTier.MODERATE, true, "Blood and lymphatic system disorders");
    public static final SafetyCategory HYPERSENSITIVITY =
            new SafetyCategory("hypersensitivity", "Allergic and hypersensitivity reactions", SeverityTier.MODERATE, true, "Immune system disorders");
    public static final SafetyCategory PULMONARY =
            new SafetyCategory("pulmonary", "Pulmonary adverse events", SeverityTier.MODERATE, true, "Respiratory disorders");
    public static final SafetyCategory RENAL =
            new SafetyCategory("renal", "Renal adverse events", SeverityTier.MODERATE, true, "Renal and urinary disorders");
    public static final SafetyCategory NEUROLOGICAL =
            new SafetyCategory("neurological", "Neurological adverse events", SeverityTier.MODERATE, false, "Nervous system disorders");
    public static final SafetyCategory NON_SERIOUS_INFECTION =
            new SafetyCategory("non_serious_infection", "Non-serious infections", SeverityTier.LOW, false, "Infections and infestations");

    // serious_infection precedes hepatotoxicity so "hepatitis B reactivation" lands in infections
    public static final TaxonomyTable<SafetyCategory> SAFETY_SIGNALS = TaxonomyTable.<SafetyCategory>builder("safety-signal")
            .entry(DEATH, "death", "died", "fatal", "mortality")
            .entry(MALIGNANCY, "malignan", "cancer", "carcinoma", "sarcoma", "lymphoma", "leukemia", "leukaemia",
                    "myeloma", "melanoma", "neoplasm", "tumor", "tumour", "metasta", "lymphoproliferative")
            .entry(GI_PERFORATION, "perforation", "gi bleed", "gastrointestinal bleeding", "gastrointestinal hemorrhage",
                    "melena", "hematochezia", "diverticulitis", "peritonitis")
            .entry(THROMBOEMBOLIC, "thromboembol", "vte", "deep vein thrombosis", "dvt", "pulmonary embol",
                    "thrombosis", "thrombus", "blood clot", "retinal vein occlusion")
            .entry(CARDIOVASCULAR, "major adverse cardi", "myocardial infarction", "heart attack", "acute coronary",
                    "unstable angina", "stroke", "cerebrovascular", "heart failure", "cardiac failure",
                    "cardiomyopathy", "myocarditis", "arrhythmia", "atrial fibrillation", "qt prolongation",
                    "sudden cardiac", "hypertension")
            .entry(SERIOUS_INFECTION, "serious infection", "severe infection", "opportunistic infection", "sepsis",
                    "septic", "bacteremia", "pneumonia", "tuberculosis", "pneumocystis", "aspergill",
                    "invasive fungal", "cryptococc", "listeria", "cytomegalovirus", "cmv", "progressive multifocal",
                    "hepatitis b reactivation", "cellulitis", "abscess", "osteomyelitis", "endocarditis",
                    "meningitis", "encephalitis", "pyelonephritis", "necrotizing fasciitis")
            .entry(HEPATOTOXICITY, "hepatotox", "liver toxicity", "liver injury", "drug-induced liver", "dili",
                    "alt increased", "ast increased", "transaminase", "liver enzymes", "hepatitis", "jaundice",
                    "hyperbilirubin", "cholesta", "liver failure", "hepatic failure")
            .entry(CYTOPENIA, "cytopenia", "neutropeni", "agranulocytosis", "leukopenia", "leucopenia",
                    "lymphopenia", "thrombocytopenia", "platelet", "anemia", "anaemia", "myelosuppression",
                    "bone marrow suppression")
            .entry(HYPERSENSITIVITY, "hypersensitivity", "allergic", "anaphyla", "angioedema", "urticaria", "hives",
                    "infusion reaction", "infusion-related", "injection site", "serum sickness",
                    "stevens-johnson", "toxic epidermal", "erythema multiforme", "dress syndrome")
            .entry(PULMONARY, "interstitial lung", "pneumonitis", "pulmonary fibrosis", "lung fibrosis",
                    "respiratory failure", "acute respiratory distress", "dyspnea", "dyspnoea",
                    "shortness of breath", "hypoxia", "bronchospasm", "pleural effusion")
            .entry(RENAL, "nephrotox", "acute kidney injury", "kidney injury", "renal failure", "renal impairment",
                    "renal insufficiency", "creatinine increased", "gfr decreased", "proteinuria", "hematuria",
                    "nephritis")
            .entry(NEUROLOGICAL, "seizure", "convulsion", "neuropathy", "guillain", "demyelinat", "encephalopathy",
                    "headache", "migraine", "dizziness", "vertigo", "syncope", "paresthesia", "paraesthesia",
                    "tremor", "confusion")
            .entry(NON_SERIOUS_INFECTION, "upper respiratory", "nasopharyngitis", "pharyngitis", "sinusitis",
                    "bronchitis", "urinary tract infection", "cystitis", "herpes simplex", "herpes zoster",
                    "shingles", "zoster", "influenza", "gastroenteritis", "conjunctivitis", "otitis",
                    "folliculitis", "candidiasis", "thrush", "tinea", "infection")
            .build();

    public static final TaxonomyTable<DurabilityClass> TIMEPOINTS = TaxonomyTable.<DurabilityClass>builder("timepoint")
            .entry(DurabilityClass.LONG_TERM, "long-term", "long term", "sustained", "durable", "maintained",
                    "maintenance", "week 52", "52 weeks", "week 48", "48 weeks", "month 12", "12 months",
                    "month 24", "24 months", "36 months", "48 months", "60 months", "1 year", "one year",
                    "2 year", "two year", "years")
            .entry(DurabilityClass.MEDIUM_TERM, "week 24", "24 weeks", "week 26", "26 weeks", "week 36",
                    "36 weeks", "week 16", "16 weeks", "month 6", "6 months", "month 3", "3 months")
            .entry(DurabilityClass.SHORT_TERM, "week 12", "12 weeks", "week 8", "8 weeks", "week 4", "4 weeks",
                    "week 2", "2 weeks", "days", "short-term", "short term", "acute")
            .build();
}

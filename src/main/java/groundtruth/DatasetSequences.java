package groundtruth;

import java.util.ArrayList;
import java.util.List;

// Fixed sequence tables of the supported benchmarks.
final class DatasetSequences {
    private DatasetSequences() {}

    static List<SequenceSpec> euroc() {
        String[] names = {"MH_01_easy", "MH_02_easy", "MH_03_medium", "MH_04_difficult", "MH_05_difficult",
                "V1_01_easy", "V1_02_medium", "V1_03_difficult", "V2_01_easy", "V2_02_medium", "V2_03_difficult"};
        int[] startFrames = {950, 800, 410, 445, 460, 22, 115, 250, 26, 100, 115};
        int[] endFrames = {3600, 3000, 2600, 1925, 2200, 2800, 1600, 2020, 2130, 2230, 1880};
        List<SequenceSpec> specs = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            specs.add(new SequenceSpec("mav_" + names[i], startFrames[i], endFrames[i], Double.NaN));
        }
        return List.copyOf(specs);
    }

    static List<SequenceSpec> tumvi() {
        String[] names = {"corridor1", "corridor2", "corridor3", "corridor4", "corridor5",
                "magistrale1", "magistrale2", "magistrale3", "magistrale4", "magistrale5", "magistrale6",
                "outdoors1", "outdoors2", "outdoors3", "outdoors4", "outdoors5", "outdoors6", "outdoors7", "outdoors8",
                "room1", "room2", "room3", "room4", "room5", "room6",
                "slides1", "slides2", "slides3"};
        double[] lengths = {305, 322, 300, 114, 270, 918, 561, 566, 688, 458, 771, 2656, 1601, 1531, 928, 1168, 2045,
                1748, 986, 146, 142, 135, 68, 131, 67, 289, 299, 383};
        List<SequenceSpec> specs = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            specs.add(new SequenceSpec("tumvi_dataset-" + names[i] + "_512_16", 2, SequenceSpec.LAST_FRAME, lengths[i]));
        }
        return List.copyOf(specs);
    }

    static List<SequenceSpec> fourSeasons() {
        Object[][] table = {
                {"office_2021-01-07_12-04-03", 3790.960147973857},
                {"office_2021-02-25_13-51-57", 3772.201462140006},
                {"office_2020-03-24_17-36-22", 3775.4838890943192},
                {"office_2020-03-24_17-45-31", 3776.5684518918497},
                {"office_2020-04-07_10-20-32", 3790.7053757221142},
                {"office_2020-06-12_10-10-57", 3776.8626523979783},
                {"neighbor_2020-10-07_14-47-51", 2120.4493722818506},
                {"neighbor_2020-10-07_14-53-52", 2124.5717222968324},
                {"neighbor_2020-12-22_11-54-24", 2153.5269533455735},
                {"neighbor_2021-02-25_13-25-15", 1885.7081876201207},
                {"neighbor_2020-03-26_13-32-55", 2106.0377819934765},
                {"neighbor_2021-05-10_18-02-12", 2160.656632453823},
                {"neighbor_2021-05-10_18-32-32", 2166.919763495766},
                {"business_2021-01-07_13-12-23", 3240.980487664213},
                {"business_2021-02-25_14-16-43", 3251.9095169019683},
                {"business_2020-10-08_09-30-57", 3011.6408305623318},
                {"country_2020-10-08_09-57-28", 6555.597982195476},
                {"country_2021-01-07_13-30-07", 6537.982081484175},
                {"country_2020-04-07_11-33-45", 6580.585081043755},
                {"country_2020-06-12_11-26-43", 6573.179452595141},
                {"city_2020-12-22_11-33-15", 10780.574894006673},
                {"city_2021-01-07_14-36-17", 10527.071542250924},
                {"city_2021-02-25_11-09-49", 10640.53519930362},
                {"oldtown_2020-10-08_11-53-41", 5034.444436444601},
                {"oldtown_2021-01-07_10-49-45", 5060.695199977825},
                {"oldtown_2021-02-25_12-34-08", 5110.7036112953065},
                {"oldtown_2021-05-10_21-32-00", 5134.989596529747},
                {"parking_2020-12-22_12-04-35", 1000.7504517487432},
                {"parking_2021-02-25_13-39-06", 846.1020208454354},
                {"parking_2021-05-10_19-15-19", 757.6168617773346},
        };
        List<SequenceSpec> specs = new ArrayList<>(table.length);
        for (Object[] row : table) {
            specs.add(new SequenceSpec("4seasons_" + row[0], 2, SequenceSpec.LAST_FRAME, (Double) row[1]));
        }
        return List.copyOf(specs);
    }
}
